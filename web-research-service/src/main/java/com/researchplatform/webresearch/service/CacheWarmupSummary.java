package com.researchplatform.webresearch.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CacheWarmupSummary(
    @JsonProperty("succeeded") int succeeded,
    @JsonProperty("failed") int failed
) {}
