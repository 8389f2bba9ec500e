package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExtractResult(
    @JsonProperty("url") String url,
    @JsonProperty("rawContent") String rawContent,
    @JsonProperty("content") String content,
    @JsonProperty("success") boolean success,
    @JsonProperty("error") String error
) {
    /** Raw content when present, otherwise the cleaned content; may be {@code null}. */
    public String bestContent() {
        return rawContent != null ? rawContent : content;
    }
}
