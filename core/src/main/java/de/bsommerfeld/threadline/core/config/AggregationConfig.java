package de.bsommerfeld.threadline.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Display-side aggregation settings. The clustering window and the minimum
 * cluster sizes are fixed and not configurable here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregationConfig {

    @JsonProperty("top-accounts-limit")
    private int topAccountsLimit = 10;

    public int getTopAccountsLimit() {
        return topAccountsLimit;
    }

    public void setTopAccountsLimit(int topAccountsLimit) {
        this.topAccountsLimit = topAccountsLimit;
    }
}
