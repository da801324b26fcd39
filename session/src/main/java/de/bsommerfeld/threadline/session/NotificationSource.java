package de.bsommerfeld.threadline.session;

import java.util.concurrent.CompletableFuture;

/**
 * Paginated notification listing, implemented by the protocol client.
 */
public interface NotificationSource {

    /**
     * @param cursor cursor returned with the previous page, {@code null} for
     *               the first page
     * @return the next page; completes exceptionally if the request failed
     */
    CompletableFuture<EventPage> fetchEvents(String cursor);
}
