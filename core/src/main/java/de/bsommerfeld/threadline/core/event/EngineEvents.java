package de.bsommerfeld.threadline.core.event;

/**
 * Events crossing module boundaries. Only events that more than one module
 * produces or consumes belong here.
 */
public class EngineEvents {

    /**
     * Posted after new or changed post facts were merged into the cache.
     *
     * @param mergedCount facts that actually changed the cache
     * @param version     cache version after the merge
     */
    public record PostFactsMergedEvent(int mergedCount, long version) {
    }

    /**
     * Summary of one enrichment pass.
     *
     * @param requested URIs claimed and sent to the network
     * @param resolved  URIs that came back
     * @param failed    URIs that failed or were missing from the response
     */
    public record EnrichmentPassEvent(int requested, int resolved, int failed) {
    }

    /**
     * Fired when conversations were recomputed after ancestry arrived.
     */
    public record ConversationsUpdatedEvent(int threadCount, long cacheVersion) {
    }
}
