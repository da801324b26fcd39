package de.bsommerfeld.threadline.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.threadline.core.domain.Actor;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw notification records into {@link NotificationEvent}s.
 *
 * <h3>Expected shape</h3>
 *
 * <pre>
 * {
 *   "uri": "at://did:plc:alice/app.bsky.feed.like/3k...",
 *   "reason": "like",
 *   "reasonSubject": "at://did:plc:me/app.bsky.feed.post/3j...",
 *   "author": { "did": "...", "handle": "...", "displayName": "...", "avatar": "..." },
 *   "indexedAt": "2024-05-01T09:00:00.000Z",
 *   "isRead": false
 * }
 * </pre>
 *
 * <h3>Rejection rules</h3>
 * A record without {@code uri}, {@code reason} or {@code indexedAt}, or with
 * a reason outside {@link Reason}, is dropped. A record whose timestamp is
 * present but unparsable survives as a listing-only event. None of this is
 * fatal: bad records are counted and logged, the rest of the page goes
 * through.
 *
 * <h3>Duplicates</h3>
 * Overlapping pages deliver the same notification twice. Records are keyed
 * by URI; the survivor is read if any copy was read, so the outcome does not
 * depend on which copy came first.
 */
@Singleton
public class EventNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(EventNormalizer.class);

    public NormalizationResult normalize(Iterable<JsonNode> records) {
        Map<String, NotificationEvent> timed = new LinkedHashMap<>();
        Map<String, NotificationEvent> untimed = new LinkedHashMap<>();
        int dropped = 0;

        for (JsonNode record : records) {
            Optional<NotificationEvent> parsed = parse(record);
            if (parsed.isEmpty()) {
                dropped++;
                continue;
            }
            NotificationEvent event = parsed.get();
            Map<String, NotificationEvent> target = event.hasTimestamp() ? timed : untimed;
            target.merge(event.uri(), event, EventNormalizer::combine);
        }

        // A URI seen with and without a parsable timestamp keeps the timed copy
        untimed.keySet().removeAll(timed.keySet());

        if (dropped > 0 || !untimed.isEmpty()) {
            LOG.warn("Normalized page: {} usable, {} listing-only, {} dropped",
                    timed.size(), untimed.size(), dropped);
        } else {
            LOG.debug("Normalized page: {} usable", timed.size());
        }
        return new NormalizationResult(new ArrayList<>(timed.values()), new ArrayList<>(untimed.values()), dropped);
    }

    /**
     * Parses one record. Returns empty for records that must be dropped;
     * a present event without timestamp is a listing-only event.
     */
    Optional<NotificationEvent> parse(JsonNode record) {
        if (record == null || !record.isObject()) {
            LOG.warn("Dropping non-object notification record");
            return Optional.empty();
        }

        String uri = text(record, "uri");
        String reasonValue = text(record, "reason");
        String indexedAtValue = text(record, "indexedAt");
        if (uri == null || reasonValue == null || indexedAtValue == null) {
            LOG.warn("Dropping notification missing required field (uri={}, reason={}, indexedAt={})",
                    uri, reasonValue, indexedAtValue);
            return Optional.empty();
        }

        Optional<Reason> reason = Reason.fromWire(reasonValue);
        if (reason.isEmpty()) {
            LOG.warn("Dropping notification {} with unknown reason '{}'", uri, reasonValue);
            return Optional.empty();
        }

        Instant indexedAt = parseTimestamp(indexedAtValue);
        if (indexedAt == null) {
            LOG.debug("Notification {} has unparsable timestamp '{}', keeping it for listing only",
                    uri, indexedAtValue);
        }

        return Optional.of(new NotificationEvent(
                reason.get(),
                parseActor(record.get("author")),
                uri,
                text(record, "reasonSubject"),
                indexedAt,
                record.path("isRead").asBoolean(false)));
    }

    static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Actor parseActor(JsonNode author) {
        if (author == null || !author.isObject()) {
            return Actor.unknown();
        }
        String id = text(author, "did");
        String handle = text(author, "handle");
        if (id == null) {
            if (handle == null) {
                return Actor.unknown();
            }
            id = handle;
        }
        return new Actor(id, handle, text(author, "displayName"), text(author, "avatar"));
    }

    private static NotificationEvent combine(NotificationEvent existing, NotificationEvent incoming) {
        return incoming.isRead() ? existing.markedRead() : existing;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
