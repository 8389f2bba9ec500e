package com.researchplatform.webresearch.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EndpointStats(
    @JsonProperty("requests") int requests,
    @JsonProperty("avgLatencyMs") double avgLatencyMs,
    @JsonProperty("creditsEstimated") double creditsEstimated,
    @JsonProperty("cacheHitRate") double cacheHitRate
) {}
