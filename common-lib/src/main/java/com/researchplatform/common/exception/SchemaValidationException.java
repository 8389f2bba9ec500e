package com.researchplatform.common.exception;

import com.researchplatform.common.model.EndpointKind;

import java.util.List;

/**
 * Upstream payload did not match the expected shape. Carries every diagnostic so the
 * caller can log the full structural diff. Counts as a circuit-breaker failure.
 */
public class SchemaValidationException extends ResearchClientException {

    private final List<String> diagnostics;

    public SchemaValidationException(EndpointKind endpoint, List<String> diagnostics) {
        super(endpoint, "Invalid " + endpoint.label() + " response schema: " + diagnostics);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
