package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One normalized search hit. {@code publishedAt} is populated for news searches;
 * {@code rawContent} only when raw content was requested.
 */
public record SearchResult(
    @JsonProperty("title") String title,
    @JsonProperty("url") String url,
    @JsonProperty("snippet") String snippet,
    @JsonProperty("publishedAt") String publishedAt,
    @JsonProperty("score") Double score,
    @JsonProperty("rawContent") String rawContent
) {}
