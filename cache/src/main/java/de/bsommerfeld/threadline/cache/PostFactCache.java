package de.bsommerfeld.threadline.cache;

import de.bsommerfeld.threadline.core.domain.PostFact;

import java.util.Collection;

/**
 * Key-to-post lookup shared by the resolver, the grouper and the enrichment
 * coordinator. All implementations must be thread-safe: merges arrive from
 * fetch threads while snapshots are taken on the caller's thread.
 *
 * <p>
 * The engine treats the cache as append-only. It adds facts and never
 * removes them, so a snapshot taken later always knows at least as much as
 * an earlier one.
 */
public interface PostFactCache {

    /**
     * Splits the requested URIs into cached facts and URIs with no entry.
     * Order of both lists follows the request order; duplicates in the
     * request are reported once.
     */
    LookupResult lookup(Collection<String> uris);

    /**
     * Upserts the given facts. A fact for an already cached URI is combined
     * field-wise via {@link PostFact#mergeWith}; each upsert is atomic per
     * key.
     *
     * @return number of entries that were added or changed
     */
    int merge(Collection<PostFact> posts);

    /**
     * Immutable view of everything cached right now, stamped with the
     * current version.
     */
    CacheSnapshot snapshot();

    /** Current version. Increases whenever {@link #merge} changes an entry. */
    long version();

    int size();
}
