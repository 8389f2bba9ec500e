package com.researchplatform.webresearch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Spend projection from the current metric window. The window is 24h, so its credit
 * total doubles as the daily estimate; the monthly figure assumes 30 such days.
 */
public record CreditProjection(
    @JsonProperty("costPerCredit") double costPerCredit,
    @JsonProperty("monthlyCreditPlan") double monthlyCreditPlan,
    @JsonProperty("estimatedDailyCredits") double estimatedDailyCredits,
    @JsonProperty("estimatedMonthlyCredits") double estimatedMonthlyCredits,
    @JsonProperty("remainingThisMonth") double remainingThisMonth,
    @JsonProperty("totalSpent") double totalSpent,
    @JsonProperty("estimatedDailyCost") double estimatedDailyCost,
    @JsonProperty("estimatedMonthlyCost") double estimatedMonthlyCost
) {}
