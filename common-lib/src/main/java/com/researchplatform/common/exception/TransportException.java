package com.researchplatform.common.exception;

import com.researchplatform.common.model.EndpointKind;

/**
 * Network failure or non-2xx HTTP status from the upstream API.
 *
 * <p>{@code statusCode} is {@code 0} when no HTTP response was received.
 * Network failures, 5xx and 429 are retryable; other 4xx are not.
 */
public class TransportException extends ResearchClientException {

    private final int statusCode;

    public TransportException(EndpointKind endpoint, int statusCode, String message) {
        super(endpoint, message);
        this.statusCode = statusCode;
    }

    public TransportException(EndpointKind endpoint, String message, Throwable cause) {
        super(endpoint, message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNetworkError() {
        return statusCode == 0;
    }

    public boolean isRetryable() {
        return statusCode == 0 || statusCode == 429 || statusCode >= 500;
    }
}
