package com.researchplatform.webresearch.validation.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** Validated body of {@code POST /extract}. {@code failedResults} is passed through untyped. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractApiResponse(
    @JsonProperty("results") List<ExtractApiResult> results,
    @JsonProperty("failed_results") List<JsonNode> failedResults
) {}
