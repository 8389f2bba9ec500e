package com.researchplatform.webresearch.validation.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MapApiResponse(
    @JsonProperty("results") List<MapApiResult> results
) {}
