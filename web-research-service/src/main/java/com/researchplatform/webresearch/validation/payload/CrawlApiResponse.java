package com.researchplatform.webresearch.validation.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CrawlApiResponse(
    @JsonProperty("results") List<CrawlApiResult> results,
    @JsonProperty("failed_results") List<JsonNode> failedResults
) {}
