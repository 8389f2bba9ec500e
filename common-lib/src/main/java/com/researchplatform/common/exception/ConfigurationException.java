package com.researchplatform.common.exception;

import com.researchplatform.common.model.EndpointKind;

/** Missing or empty credential/configuration. Never retried. */
public class ConfigurationException extends ResearchClientException {

    public ConfigurationException(EndpointKind endpoint, String message) {
        super(endpoint, message);
    }
}
