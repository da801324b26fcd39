package de.bsommerfeld.threadline.core.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * The kind of interaction a notification represents. The wire value is the
 * lower-case name used by the protocol ({@code "like"}, {@code "reply"}, ...).
 *
 * <p>
 * Only {@link #LIKE}, {@link #REPOST}, {@link #FOLLOW} and {@link #QUOTE} are
 * aggregable. Replies and mentions carry individual content and are always
 * shown on their own.
 */
public enum Reason {

    LIKE(true, 3),
    REPOST(true, 3),
    FOLLOW(true, 2),
    QUOTE(true, 3),
    REPLY(false, 1),
    MENTION(false, 1);

    private final boolean aggregable;
    private final int minClusterSize;

    Reason(boolean aggregable, int minClusterSize) {
        this.aggregable = aggregable;
        this.minClusterSize = minClusterSize;
    }

    public boolean isAggregable() {
        return aggregable;
    }

    /**
     * Smallest chain that may be collapsed into a cluster. Follows are
     * low-content, so two already justify grouping.
     */
    public int minClusterSize() {
        return minClusterSize;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a protocol reason string onto a known variant. Unknown values
     * (new protocol reasons, typos, {@code null}) yield an empty result so
     * the caller can reject the record.
     */
    public static Optional<Reason> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "like":
                return Optional.of(LIKE);
            case "repost":
                return Optional.of(REPOST);
            case "follow":
                return Optional.of(FOLLOW);
            case "quote":
                return Optional.of(QUOTE);
            case "reply":
                return Optional.of(REPLY);
            case "mention":
                return Optional.of(MENTION);
            default:
                return Optional.empty();
        }
    }
}
