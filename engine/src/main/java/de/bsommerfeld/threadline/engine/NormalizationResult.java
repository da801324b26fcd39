package de.bsommerfeld.threadline.engine;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;

import java.util.List;

/**
 * Output of {@link EventNormalizer}.
 *
 * @param events      well-formed events, safe for clustering and threading
 * @param listingOnly events whose timestamp could not be parsed; shown in
 *                    plain lists but kept out of every time-based view
 * @param dropped     records rejected outright
 */
public record NormalizationResult(
        List<NotificationEvent> events,
        List<NotificationEvent> listingOnly,
        int dropped) {

    public NormalizationResult {
        events = ImmutableList.copyOf(events);
        listingOnly = ImmutableList.copyOf(listingOnly);
    }

    public int accepted() {
        return events.size() + listingOnly.size();
    }
}
