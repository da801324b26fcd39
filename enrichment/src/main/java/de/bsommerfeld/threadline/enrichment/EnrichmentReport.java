package de.bsommerfeld.threadline.enrichment;

/**
 * Counters of one or more enrichment passes.
 *
 * @param requested URIs sent to the network
 * @param resolved  URIs that came back
 * @param failed    URIs of failed batches plus URIs missing from responses
 * @param rounds    passes that were run
 */
public record EnrichmentReport(int requested, int resolved, int failed, int rounds) {

    public static final EnrichmentReport EMPTY = new EnrichmentReport(0, 0, 0, 0);

    public EnrichmentReport plus(EnrichmentReport other) {
        return new EnrichmentReport(
                requested + other.requested,
                resolved + other.resolved,
                failed + other.failed,
                rounds + other.rounds);
    }
}
