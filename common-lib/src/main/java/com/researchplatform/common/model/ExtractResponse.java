package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractResponse(
    @JsonProperty("results") List<ExtractResult> results,
    @JsonProperty("error") String error
) {
    public static ExtractResponse of(List<ExtractResult> results) {
        return new ExtractResponse(List.copyOf(results), null);
    }

    public static ExtractResponse degraded(String error) {
        return new ExtractResponse(List.of(), error);
    }

    public boolean isDegraded() {
        return error != null;
    }
}
