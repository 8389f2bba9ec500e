package com.researchplatform.webresearch.validation.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Validated body of {@code POST /search}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchApiResponse(
    @JsonProperty("query") String query,
    @JsonProperty("results") List<SearchApiResult> results,
    @JsonProperty("answer") String answer,
    @JsonProperty("response_time") Double responseTime,
    @JsonProperty("images") List<String> images,
    @JsonProperty("follow_up_questions") List<String> followUpQuestions
) {}
