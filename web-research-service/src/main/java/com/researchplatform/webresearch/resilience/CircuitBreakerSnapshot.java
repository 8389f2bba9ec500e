package com.researchplatform.webresearch.resilience;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CircuitBreakerSnapshot(
    @JsonProperty("state") CircuitState state,
    @JsonProperty("failureCount") int failureCount,
    @JsonProperty("lastFailureAt") Instant lastFailureAt,
    @JsonProperty("openedAt") Instant openedAt,
    @JsonProperty("nextAttemptAt") Instant nextAttemptAt
) {}
