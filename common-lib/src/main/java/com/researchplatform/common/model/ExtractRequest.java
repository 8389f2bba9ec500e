package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ExtractRequest(
    @JsonProperty("urls") List<String> urls,
    @JsonProperty("depth") Depth depth,
    @JsonProperty("format") String format,               // markdown / html
    @JsonProperty("includeImages") Boolean includeImages
) {
    public static ExtractRequest of(List<String> urls) {
        return new ExtractRequest(urls, null, null, null);
    }

    public static ExtractRequest of(List<String> urls, Depth depth) {
        return new ExtractRequest(urls, depth, null, null);
    }
}
