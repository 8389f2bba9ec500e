package com.researchplatform.common.exception;

import com.researchplatform.common.model.EndpointKind;

/**
 * Base type for every failure raised below the research client's composition layer.
 *
 * <p>{@code endpoint} is {@code null} for failures that are not tied to one capability,
 * such as local rate-limiter saturation.
 */
public class ResearchClientException extends RuntimeException {

    private final EndpointKind endpoint;

    public ResearchClientException(EndpointKind endpoint, String message) {
        super(message);
        this.endpoint = endpoint;
    }

    public ResearchClientException(EndpointKind endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public EndpointKind getEndpoint() {
        return endpoint;
    }
}
