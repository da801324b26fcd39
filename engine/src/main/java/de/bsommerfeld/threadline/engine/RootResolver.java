package de.bsommerfeld.threadline.engine;

import com.google.inject.Singleton;
import de.bsommerfeld.threadline.cache.CacheSnapshot;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.PostFact;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds the conversation root of a reply using only the post facts of one
 * {@link CacheSnapshot}.
 *
 * <h3>Resolution order</h3>
 * <ol>
 * <li>The reply's own fact declares a root: use it.</li>
 * <li>The reply's fact declares a cached parent: walk up until an ancestor
 * declares a root or has no cached parent.</li>
 * <li>No usable fact for the reply, but the subject is cached: walk up from
 * the subject instead. Siblings whose own post is still missing then land
 * under the same root as the ones already fetched.</li>
 * <li>A subject is known but not cached: the subject is a provisional root
 * until ancestry arrives.</li>
 * <li>Nothing known: the reply is its own (orphan) root.</li>
 * </ol>
 *
 * <h3>Termination</h3>
 * The walk carries a visited set and returns the first URI it sees twice,
 * so corrupt data such as {@code A → B → A} ends after at most one lap. It is
 * iterative, bounded by the number of cached facts.
 *
 * <h3>Monotonicity</h3>
 * The cache only grows, so answers only get better. One case needs care:
 * once the reply's own fact is cached but its parent is not, the walk cannot
 * leave the reply. Falling back to the reply's URI there would undo the
 * subject-based answer given before the fact arrived, so the subject is kept.
 *
 * <h3>Memoization</h3>
 * Results are memoized for the snapshot instance they were computed
 * against. Any other snapshot, even one carrying the same version, discards
 * the memo.
 */
@Singleton
public class RootResolver {

    private volatile Memo memo = new Memo(CacheSnapshot.empty());

    private record MemoKey(String uri, String subjectUri) {
    }

    /** Answers computed against exactly one snapshot instance. */
    private record Memo(CacheSnapshot snapshot, Map<MemoKey, String> roots) {

        Memo(CacheSnapshot snapshot) {
            this(snapshot, new ConcurrentHashMap<>());
        }
    }

    public String resolve(NotificationEvent reply, CacheSnapshot snapshot) {
        Memo current = memo;
        if (current.snapshot() != snapshot) {
            current = new Memo(snapshot);
            memo = current;
        }
        return current.roots().computeIfAbsent(new MemoKey(reply.uri(), reply.subjectUri()),
                key -> resolveUncached(key.uri(), key.subjectUri(), snapshot));
    }

    /**
     * Resolution without memoization. Exposed for callers that hold a
     * one-off snapshot and do not want to disturb the memo.
     */
    public static String resolveUncached(String uri, String subjectUri, CacheSnapshot snapshot) {
        if (snapshot.contains(uri)) {
            String root = walkToRoot(uri, snapshot, new HashSet<>());
            if (!root.equals(uri) || subjectUri == null) {
                return root;
            }
        }
        if (subjectUri == null) {
            return uri;
        }
        return snapshot.contains(subjectUri) ? walkToRoot(subjectUri, snapshot, new HashSet<>()) : subjectUri;
    }

    /**
     * Walks parent links starting at {@code uri}. Returns a declared root as
     * soon as one is found, the topmost cached ancestor otherwise, or the
     * first revisited URI when the chain loops.
     *
     * @param visited URIs already seen on this walk; mutated
     */
    public static String walkToRoot(String uri, CacheSnapshot snapshot, Set<String> visited) {
        String current = uri;
        while (true) {
            if (!visited.add(current)) {
                return current;
            }
            Optional<PostFact> fact = snapshot.get(current);
            if (fact.isEmpty()) {
                return current;
            }
            PostFact post = fact.get();
            if (post.rootUri() != null) {
                return post.rootUri();
            }
            String parent = post.parentUri();
            if (parent == null || parent.equals(current) || !snapshot.contains(parent)) {
                return current;
            }
            current = parent;
        }
    }

    int memoSize() {
        return memo.roots().size();
    }
}
