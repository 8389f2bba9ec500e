package com.researchplatform.webresearch.validation;

import com.researchplatform.common.exception.SchemaValidationException;
import com.researchplatform.common.model.EndpointKind;

import java.util.List;

/** Either a decoded payload or the list of structural diagnostics; never both. */
public record ValidationResult<T>(T value, List<String> diagnostics) {

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(value, List.of());
    }

    public static <T> ValidationResult<T> invalid(List<String> diagnostics) {
        return new ValidationResult<>(null, List.copyOf(diagnostics));
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }

    public T orElseThrow(EndpointKind endpoint) {
        if (!isValid()) {
            throw new SchemaValidationException(endpoint, diagnostics);
        }
        return value;
    }
}
