package de.bsommerfeld.threadline.core.domain;

import java.util.Objects;

/**
 * The account that caused a notification.
 *
 * @param id          stable account identifier (a DID on the wire)
 * @param handle      human-readable handle, may change over time
 * @param displayName optional display name, {@code null} if unset
 * @param avatarRef   optional avatar URL, {@code null} if unset
 */
public record Actor(String id, String handle, String displayName, String avatarRef) {

    private static final String UNKNOWN = "unknown";

    public Actor {
        Objects.requireNonNull(id, "id");
        handle = handle != null ? handle : id;
    }

    public Actor(String id, String handle) {
        this(id, handle, null, null);
    }

    /**
     * Placeholder for records that arrive without author data. All unknown
     * actors share one id, so they collapse into a single entry in a
     * cluster's actor list.
     */
    public static Actor unknown() {
        return new Actor(UNKNOWN, UNKNOWN, null, null);
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(id);
    }
}
