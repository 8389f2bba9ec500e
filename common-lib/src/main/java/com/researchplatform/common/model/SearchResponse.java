package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a search call. A degraded response carries an empty result list and a
 * non-null {@code error}; callers never receive an exception.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResponse(
    @JsonProperty("query") String query,
    @JsonProperty("results") List<SearchResult> results,
    @JsonProperty("error") String error
) {
    public static SearchResponse of(String query, List<SearchResult> results) {
        return new SearchResponse(query, List.copyOf(results), null);
    }

    public static SearchResponse degraded(String query, String error) {
        return new SearchResponse(query, List.of(), error);
    }

    public boolean isDegraded() {
        return error != null;
    }
}
