package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrawlResponse(
    @JsonProperty("results") List<CrawlResult> results,
    @JsonProperty("error") String error
) {
    public static CrawlResponse of(List<CrawlResult> results) {
        return new CrawlResponse(List.copyOf(results), null);
    }

    public static CrawlResponse degraded(String error) {
        return new CrawlResponse(List.of(), error);
    }

    public boolean isDegraded() {
        return error != null;
    }
}
