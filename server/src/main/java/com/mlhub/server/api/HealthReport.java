package com.mlhub.server.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public class HealthReport {

    @JsonProperty("status")
    public final String status;

    @JsonProperty("cached_models")
    public final int cachedModels;

    /** framework tag to engine version */
    @JsonProperty("backends")
    public final Map<String, String> backends;

    public HealthReport(String status, int cachedModels, Map<String, String> backends) {
        this.status = status;
        this.cachedModels = cachedModels;
        this.backends = backends;
    }
}
