package de.bsommerfeld.threadline.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code threadline.toml}. Each section maps onto its own POJO so
 * modules can be handed only the part they need.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThreadlineConfig {

    @JsonProperty("aggregation")
    private AggregationConfig aggregation = new AggregationConfig();

    @JsonProperty("enrichment")
    private EnrichmentConfig enrichment = new EnrichmentConfig();

    public AggregationConfig getAggregation() {
        return aggregation;
    }

    public EnrichmentConfig getEnrichment() {
        return enrichment;
    }
}
