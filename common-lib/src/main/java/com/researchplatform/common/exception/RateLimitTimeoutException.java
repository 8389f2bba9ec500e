package com.researchplatform.common.exception;

import java.time.Duration;

public class RateLimitTimeoutException extends ResearchClientException {

    public RateLimitTimeoutException(Duration waited) {
        super(null, "Rate limit queue timeout (" + waited.toSeconds() + "s)");
    }

    public RateLimitTimeoutException(String message) {
        super(null, message);
    }
}
