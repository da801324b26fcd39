package de.bsommerfeld.threadline.engine;

import de.bsommerfeld.threadline.core.domain.FeedItem;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;

import java.time.Instant;
import java.util.Comparator;

/**
 * Total orders shared by every view. Timestamps alone are not unique, so
 * each order falls back to the URI, which makes results independent of the
 * order events arrived in.
 */
public final class EventOrder {

    /** Newest first, then URI ascending. */
    public static final Comparator<NotificationEvent> NEWEST_FIRST = Comparator
            .comparing(NotificationEvent::indexedAt, Comparator.reverseOrder())
            .thenComparing(NotificationEvent::uri);

    /**
     * Like {@link #NEWEST_FIRST}, but tolerates listing-only events, which
     * sort after every timed event.
     */
    public static final Comparator<NotificationEvent> NEWEST_FIRST_UNTIMED_LAST = Comparator
            .comparing(NotificationEvent::indexedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(NotificationEvent::uri);

    /** Newest effective timestamp first, then sort key ascending. */
    public static final Comparator<FeedItem> FEED = Comparator
            .comparing(FeedItem::effectiveTimestamp, Comparator.reverseOrder())
            .thenComparing(FeedItem::sortKey);

    private EventOrder() {
    }
}
