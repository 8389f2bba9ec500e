package com.researchplatform.common.exception;

import com.researchplatform.common.model.EndpointKind;

import java.time.Instant;

public class CircuitOpenException extends ResearchClientException {

    private final Instant nextAttemptAt;

    public CircuitOpenException(EndpointKind endpoint, Instant nextAttemptAt) {
        super(endpoint, "Circuit breaker OPEN for " + endpoint.label()
            + ". Next attempt at " + nextAttemptAt);
        this.nextAttemptAt = nextAttemptAt;
    }

    /** Half-open probe already in flight; the breaker admits only one trial call. */
    public CircuitOpenException(EndpointKind endpoint) {
        super(endpoint, "Circuit breaker HALF_OPEN for " + endpoint.label()
            + ". Trial request already in flight");
        this.nextAttemptAt = null;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }
}
