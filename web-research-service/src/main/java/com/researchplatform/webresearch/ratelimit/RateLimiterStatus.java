package com.researchplatform.webresearch.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RateLimiterStatus(
    @JsonProperty("tier") String tier,
    @JsonProperty("availableTokens") int availableTokens,
    @JsonProperty("capacity") int capacity,
    @JsonProperty("refillRatePerMinute") double refillRatePerMinute,
    @JsonProperty("queueLength") int queueLength,
    @JsonProperty("utilizationPercent") double utilizationPercent
) {}
