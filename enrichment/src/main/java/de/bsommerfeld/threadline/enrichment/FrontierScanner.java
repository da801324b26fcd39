package de.bsommerfeld.threadline.enrichment;

import de.bsommerfeld.threadline.cache.CacheSnapshot;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.PostFact;
import de.bsommerfeld.threadline.core.domain.Reason;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Computes which post URIs are referenced but not yet cached. Pure: the
 * result depends on the snapshot (and reply events) only, never on what is
 * currently in flight. Filtering in-flight and failed URIs is the
 * coordinator's job.
 */
public final class FrontierScanner {

    private FrontierScanner() {
    }

    /**
     * Every {@code parentUri} and {@code rootUri} declared by a cached fact
     * whose target is not cached itself, sorted ascending.
     */
    public static List<String> scan(CacheSnapshot snapshot) {
        TreeSet<String> frontier = new TreeSet<>();
        for (PostFact fact : snapshot.facts()) {
            if (!fact.isReply()) {
                continue;
            }
            addIfMissing(frontier, fact.parentUri(), snapshot);
            addIfMissing(frontier, fact.rootUri(), snapshot);
        }
        return new ArrayList<>(frontier);
    }

    /**
     * Like {@link #scan(CacheSnapshot)}, seeded with the replies' own posts
     * and subjects. Without the reply's own post there is nothing to walk,
     * so those are the first facts worth fetching.
     */
    public static List<String> scan(CacheSnapshot snapshot, Collection<NotificationEvent> replies) {
        TreeSet<String> frontier = new TreeSet<>(scan(snapshot));
        for (NotificationEvent reply : replies) {
            if (reply.reason() != Reason.REPLY) {
                continue;
            }
            addIfMissing(frontier, reply.uri(), snapshot);
            addIfMissing(frontier, reply.subjectUri(), snapshot);
        }
        return new ArrayList<>(frontier);
    }

    private static void addIfMissing(Collection<String> frontier, String uri, CacheSnapshot snapshot) {
        if (uri != null && !snapshot.contains(uri)) {
            frontier.add(uri);
        }
    }
}
