package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MapResult(
    @JsonProperty("url") String url,
    @JsonProperty("title") String title
) {}
