package com.researchplatform.webresearch.validation.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractApiResult(
    @JsonProperty("url") String url,
    @JsonProperty("raw_content") String rawContent,
    @JsonProperty("content") String content,
    @JsonProperty("success") boolean success,
    @JsonProperty("error") String error
) {}
