package de.bsommerfeld.threadline.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ancestry fetching parameters. Values are persisted in threadline.toml
 * and loaded at startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnrichmentConfig {

    /** The post lookup endpoint rejects more than 25 URIs per request. */
    public static final int MAX_BATCH_SIZE = 25;

    @JsonProperty("batch-size")
    private int batchSize = MAX_BATCH_SIZE;

    @JsonProperty("max-rounds")
    private int maxRounds = 8;

    @JsonProperty("fetch-threads")
    private int fetchThreads = 2;

    /**
     * Requested batch size clamped to {@code [1, MAX_BATCH_SIZE]}, so a
     * hand-edited config cannot produce oversized requests.
     */
    public int getBatchSize() {
        return Math.max(1, Math.min(batchSize, MAX_BATCH_SIZE));
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxRounds() {
        return Math.max(1, maxRounds);
    }

    public void setMaxRounds(int maxRounds) {
        this.maxRounds = maxRounds;
    }

    public int getFetchThreads() {
        return Math.max(1, fetchThreads);
    }

    public void setFetchThreads(int fetchThreads) {
        this.fetchThreads = fetchThreads;
    }
}
