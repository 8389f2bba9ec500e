package com.researchplatform.webresearch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.researchplatform.common.model.EndpointKind;
import com.researchplatform.webresearch.metrics.AggregatedMetrics;
import com.researchplatform.webresearch.ratelimit.RateLimiterStatus;
import com.researchplatform.webresearch.resilience.CircuitBreakerSnapshot;
import com.researchplatform.webresearch.service.CacheStats;

import java.time.Instant;
import java.util.Map;

public record UsageReport(
    @JsonProperty("generatedAt") Instant generatedAt,
    @JsonProperty("summary") UsageSummary summary,
    @JsonProperty("metrics") AggregatedMetrics metrics,
    @JsonProperty("credits") CreditProjection credits,
    @JsonProperty("cache") CacheStats cache,
    @JsonProperty("rateLimiter") RateLimiterStatus rateLimiter,
    @JsonProperty("circuitBreakers") Map<EndpointKind, CircuitBreakerSnapshot> circuitBreakers,
    @JsonProperty("textReport") String textReport
) {}
