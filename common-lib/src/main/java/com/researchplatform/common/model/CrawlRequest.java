package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Crawl request rooted at {@code url}. Null limits fall back to max depth 1,
 * max breadth 50, limit 100 and basic extraction of each crawled page.
 */
public record CrawlRequest(
    @JsonProperty("url") String url,
    @JsonProperty("maxDepth") Integer maxDepth,
    @JsonProperty("maxBreadth") Integer maxBreadth,
    @JsonProperty("limit") Integer limit,
    @JsonProperty("selectPaths") List<String> selectPaths,
    @JsonProperty("excludePaths") List<String> excludePaths,
    @JsonProperty("extractDepth") Depth extractDepth
) {
    public static CrawlRequest of(String url) {
        return new CrawlRequest(url, null, null, null, null, null, null);
    }
}
