package com.researchplatform.webresearch.validation.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchApiResult(
    @JsonProperty("title") String title,
    @JsonProperty("url") String url,
    @JsonProperty("content") String content,
    @JsonProperty("snippet") String snippet,
    @JsonProperty("score") double score,
    @JsonProperty("published_date") String publishedDate,
    @JsonProperty("raw_content") String rawContent
) {}
