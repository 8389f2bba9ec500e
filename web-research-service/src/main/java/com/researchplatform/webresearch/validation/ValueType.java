package com.researchplatform.webresearch.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** Checks one non-null JSON value, appending a {@code path: problem} line per violation. */
@FunctionalInterface
public interface ValueType {

    void check(JsonNode value, String path, List<String> diagnostics);
}
