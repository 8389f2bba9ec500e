package com.researchplatform.webresearch.validation.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CrawlApiResult(
    @JsonProperty("url") String url,
    @JsonProperty("content") String content,
    @JsonProperty("raw_content") String rawContent,
    @JsonProperty("success") boolean success,
    @JsonProperty("error") String error
) {}
