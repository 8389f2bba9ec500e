package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MapResponse(
    @JsonProperty("results") List<MapResult> results,
    @JsonProperty("error") String error
) {
    public static MapResponse of(List<MapResult> results) {
        return new MapResponse(List.copyOf(results), null);
    }

    public static MapResponse degraded(String error) {
        return new MapResponse(List.of(), error);
    }

    public boolean isDegraded() {
        return error != null;
    }
}
