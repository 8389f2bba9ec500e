package com.researchplatform.webresearch.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.researchplatform.common.model.EndpointKind;

import java.time.Instant;
import java.util.Map;

/** One recorded upstream operation (or cache hit standing in for one). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricEntry(
    @JsonProperty("operation") String operation,
    @JsonProperty("endpoint") EndpointKind endpoint,
    @JsonProperty("latencyMs") long latencyMs,
    @JsonProperty("creditsEstimated") double creditsEstimated,
    @JsonProperty("cacheHit") boolean cacheHit,
    @JsonProperty("success") boolean success,
    @JsonProperty("errorType") String errorType,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("metadata") Map<String, Object> metadata
) {}
