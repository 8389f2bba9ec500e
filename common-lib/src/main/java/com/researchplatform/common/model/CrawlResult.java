package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CrawlResult(
    @JsonProperty("url") String url,
    @JsonProperty("content") String content,
    @JsonProperty("rawContent") String rawContent,
    @JsonProperty("success") boolean success,
    @JsonProperty("error") String error
) {}
