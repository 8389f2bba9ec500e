package com.researchplatform.common.exception;

/** No token was free and the caller asked not to wait. */
public class RateLimitExceededException extends ResearchClientException {

    public RateLimitExceededException() {
        super(null, "Rate limit exceeded (non-blocking mode)");
    }
}
