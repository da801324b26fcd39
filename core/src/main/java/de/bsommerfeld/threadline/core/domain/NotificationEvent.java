package de.bsommerfeld.threadline.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable, normalized notification. Identity is the {@code uri}: two
 * events with the same URI describe the same interaction.
 *
 * @param reason     interaction type
 * @param actor      account that triggered the notification
 * @param uri        URI of the interaction record (the reply post for replies)
 * @param subjectUri URI of the post the interaction concerns, {@code null}
 *                   when not declared on the record
 * @param indexedAt  authoritative ordering timestamp, {@code null} only for
 *                   listing-only events whose timestamp could not be parsed
 * @param isRead     whether the user has seen the notification
 */
public record NotificationEvent(
        Reason reason,
        Actor actor,
        String uri,
        String subjectUri,
        Instant indexedAt,
        boolean isRead) implements FeedItem {

    public NotificationEvent {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(uri, "uri");
    }

    public boolean hasTimestamp() {
        return indexedAt != null;
    }

    /**
     * Returns a copy marked as read. Used when duplicate records disagree on
     * the read flag: once any copy was read, the notification stays read.
     */
    public NotificationEvent markedRead() {
        return isRead ? this : new NotificationEvent(reason, actor, uri, subjectUri, indexedAt, true);
    }

    @Override
    public Instant effectiveTimestamp() {
        return indexedAt;
    }

    @Override
    public String sortKey() {
        return uri;
    }
}
