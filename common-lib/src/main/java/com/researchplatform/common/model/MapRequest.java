package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Site-map discovery request rooted at {@code url}. Null limits fall back to
 * max depth 2 and max breadth 50.
 */
public record MapRequest(
    @JsonProperty("url") String url,
    @JsonProperty("maxDepth") Integer maxDepth,
    @JsonProperty("maxBreadth") Integer maxBreadth,
    @JsonProperty("limit") Integer limit,
    @JsonProperty("selectPaths") List<String> selectPaths,
    @JsonProperty("excludePaths") List<String> excludePaths,
    @JsonProperty("instructions") String instructions
) {
    public static MapRequest of(String url) {
        return new MapRequest(url, null, null, null, null, null, null);
    }
}
