package com.researchplatform.webresearch.resilience;

import java.time.Duration;

/** Exponential backoff for transient failures; {@code maxRetries} excludes the first attempt. */
public record RetryPolicy(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    double jitter
) {
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(8), 0.3);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ofMillis(1), Duration.ofMillis(1), 0.0);
    }
}
