package de.bsommerfeld.threadline.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One page of raw notification records as delivered by the protocol.
 *
 * @param events raw records, not yet validated
 * @param cursor cursor for the next page, {@code null} on the last page
 */
public record EventPage(List<JsonNode> events, String cursor) {

    public EventPage {
        events = ImmutableList.copyOf(events);
    }

    public boolean isLast() {
        return cursor == null || cursor.isEmpty();
    }
}
