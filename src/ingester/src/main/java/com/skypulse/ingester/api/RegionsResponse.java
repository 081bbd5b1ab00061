package com.skypulse.ingester.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.skypulse.ingester.budget.BudgetState;
import java.util.List;

public record RegionsResponse(
    @JsonProperty("regions") List<RegionSummary> regions,
    @JsonProperty("budget") BudgetState budget) {}
