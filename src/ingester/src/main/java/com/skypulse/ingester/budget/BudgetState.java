package com.skypulse.ingester.budget;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Read-only view of the rolling credit window. */
public record BudgetState(
    @JsonProperty("consumed") long consumed,
    @JsonProperty("remaining") long remaining,
    @JsonProperty("limit") long limit,
    @JsonProperty("window_hours") long windowHours,
    @JsonProperty("percent_used") double percentUsed) {}
