package de.bsommerfeld.threadline.cache;

import com.google.inject.Singleton;
import de.bsommerfeld.threadline.core.domain.PostFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Session-scoped {@link PostFactCache} backed by a {@link ConcurrentHashMap}.
 *
 * <h3>Threading model</h3>
 * Merges run on the enrichment executor, snapshots on whichever thread
 * recomputes the views. Each key is upserted through
 * {@link ConcurrentHashMap#merge}, so a second fact for the same URI
 * combines with the first instead of overwriting it. The version counter is
 * bumped once per merge call that changed something.
 *
 * <h3>Snapshot consistency</h3>
 * A merge call and the version bump it causes happen under the same lock
 * that {@link #snapshot()} copies under, so a snapshot's version always
 * describes exactly the facts it holds. Size and version reads stay
 * lock-free.
 */
@Singleton
public class InMemoryPostFactCache implements PostFactCache {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryPostFactCache.class);

    private final Map<String, PostFact> facts = new ConcurrentHashMap<>();
    private final AtomicLong version = new AtomicLong();
    private final Object writeLock = new Object();

    @Override
    public LookupResult lookup(Collection<String> uris) {
        return snapshot().lookup(uris);
    }

    @Override
    public int merge(Collection<PostFact> posts) {
        if (posts == null || posts.isEmpty()) {
            return 0;
        }
        int changed = 0;
        long v;
        synchronized (writeLock) {
            for (PostFact post : posts) {
                if (post == null) {
                    continue;
                }
                PostFact before = facts.get(post.uri());
                PostFact after = facts.merge(post.uri(), post, PostFact::mergeWith);
                if (!after.equals(before)) {
                    changed++;
                }
            }
            if (changed == 0) {
                return 0;
            }
            v = version.incrementAndGet();
        }
        LOG.debug("Merged {} post facts, cache now holds {} (version {})", changed, facts.size(), v);
        return changed;
    }

    @Override
    public CacheSnapshot snapshot() {
        synchronized (writeLock) {
            return new CacheSnapshot(facts, version.get());
        }
    }

    @Override
    public long version() {
        return version.get();
    }

    @Override
    public int size() {
        return facts.size();
    }
}
