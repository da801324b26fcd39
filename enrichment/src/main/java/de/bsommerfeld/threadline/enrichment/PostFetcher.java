package de.bsommerfeld.threadline.enrichment;

import de.bsommerfeld.threadline.core.domain.PostFact;

import java.util.List;

/**
 * Network operation that looks posts up by URI. Implemented by the protocol
 * client; the engine only calls it from the enrichment executor.
 */
public interface PostFetcher {

    /**
     * Fetches the given posts in one request. Posts that no longer exist are
     * simply absent from the result.
     *
     * @param uris at most {@link de.bsommerfeld.threadline.core.config.EnrichmentConfig#MAX_BATCH_SIZE} URIs
     * @return facts for the posts that were found, in any order
     * @throws PostFetchException if the request as a whole failed
     */
    List<PostFact> fetchPostsByUri(List<String> uris) throws PostFetchException;
}
