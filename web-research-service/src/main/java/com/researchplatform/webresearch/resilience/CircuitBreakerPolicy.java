package com.researchplatform.webresearch.resilience;

import java.time.Duration;

/**
 * Opening rule for one endpoint: {@code failureThreshold} failures inside
 * {@code failureWindow} open the breaker for {@code coolDown}.
 */
public record CircuitBreakerPolicy(
    int failureThreshold,
    Duration failureWindow,
    Duration coolDown
) {
    public CircuitBreakerPolicy {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
    }

    /** Search and extract: 5 failures in 60s, 30s cool-down. */
    public static CircuitBreakerPolicy interactive() {
        return new CircuitBreakerPolicy(5, Duration.ofSeconds(60), Duration.ofSeconds(30));
    }

    /** Map and crawl: 3 failures in 60s, 60s cool-down. */
    public static CircuitBreakerPolicy bulk() {
        return new CircuitBreakerPolicy(3, Duration.ofSeconds(60), Duration.ofSeconds(60));
    }
}
