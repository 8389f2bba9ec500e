package com.researchplatform.webresearch.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Entry counts per keyspace; expired entries not yet read are still counted. */
public record CacheStats(
    @JsonProperty("searchEntries") int searchEntries,
    @JsonProperty("extractEntries") int extractEntries
) {}
