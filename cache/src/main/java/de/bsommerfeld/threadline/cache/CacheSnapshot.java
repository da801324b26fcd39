package de.bsommerfeld.threadline.cache;

import com.google.common.collect.ImmutableMap;
import de.bsommerfeld.threadline.core.domain.PostFact;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frozen copy of the post fact cache. Every pure computation (root
 * resolution, grouping, frontier scanning) runs against one snapshot, which
 * is what makes their results reproducible.
 *
 * <p>
 * Snapshots are also usable as a {@link PostFactCache}-like read source in
 * tests: {@link #of} builds one directly from facts.
 */
public final class CacheSnapshot {

    private static final CacheSnapshot EMPTY = new CacheSnapshot(ImmutableMap.of(), 0L);

    private final ImmutableMap<String, PostFact> facts;
    private final long version;

    CacheSnapshot(Map<String, PostFact> facts, long version) {
        this.facts = ImmutableMap.copyOf(facts);
        this.version = version;
    }

    public static CacheSnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from loose facts. Later facts for the same URI are
     * merged into earlier ones the same way the cache would merge them.
     */
    public static CacheSnapshot of(long version, Collection<PostFact> posts) {
        Map<String, PostFact> merged = new LinkedHashMap<>();
        for (PostFact post : posts) {
            merged.merge(post.uri(), post, PostFact::mergeWith);
        }
        return new CacheSnapshot(merged, version);
    }

    public static CacheSnapshot of(long version, PostFact... posts) {
        return of(version, List.of(posts));
    }

    public Optional<PostFact> get(String uri) {
        return uri == null ? Optional.empty() : Optional.ofNullable(facts.get(uri));
    }

    public boolean contains(String uri) {
        return uri != null && facts.containsKey(uri);
    }

    public Collection<PostFact> facts() {
        return facts.values();
    }

    public LookupResult lookup(Collection<String> uris) {
        List<PostFact> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String uri : new LinkedHashSet<>(uris)) {
            PostFact fact = facts.get(uri);
            if (fact != null) {
                found.add(fact);
            } else {
                missing.add(uri);
            }
        }
        return new LookupResult(found, missing);
    }

    public long version() {
        return version;
    }

    public int size() {
        return facts.size();
    }

    @Override
    public String toString() {
        return "CacheSnapshot{version=" + version + ", size=" + facts.size() + "}";
    }
}
