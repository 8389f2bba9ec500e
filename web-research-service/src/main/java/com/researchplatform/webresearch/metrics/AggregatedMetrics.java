package com.researchplatform.webresearch.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.researchplatform.common.model.EndpointKind;

import java.util.Map;

/** Summary of the metric window. Latency figures are in milliseconds. */
public record AggregatedMetrics(
    @JsonProperty("totalRequests") int totalRequests,
    @JsonProperty("successfulRequests") int successfulRequests,
    @JsonProperty("failedRequests") int failedRequests,
    @JsonProperty("cacheHits") int cacheHits,
    @JsonProperty("cacheMisses") int cacheMisses,
    @JsonProperty("totalLatencyMs") long totalLatencyMs,
    @JsonProperty("avgLatencyMs") double avgLatencyMs,
    @JsonProperty("p50LatencyMs") long p50LatencyMs,
    @JsonProperty("p95LatencyMs") long p95LatencyMs,
    @JsonProperty("p99LatencyMs") long p99LatencyMs,
    @JsonProperty("totalCreditsEstimated") double totalCreditsEstimated,
    @JsonProperty("byEndpoint") Map<EndpointKind, EndpointStats> byEndpoint,
    @JsonProperty("errors") Map<String, Integer> errors
) {
    public static AggregatedMetrics empty() {
        return new AggregatedMetrics(0, 0, 0, 0, 0, 0L, 0.0, 0L, 0L, 0L, 0.0, Map.of(), Map.of());
    }
}
