package com.researchplatform.webresearch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UsageSummary(
    @JsonProperty("totalRequests") int totalRequests,
    @JsonProperty("totalCreditsUsed") double totalCreditsUsed,
    @JsonProperty("cacheHitRatePercent") double cacheHitRatePercent,
    @JsonProperty("successRatePercent") double successRatePercent,
    @JsonProperty("avgCostPerRequest") double avgCostPerRequest
) {}
