package com.skypulse.ingester.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record AirportListResponse(
    @JsonProperty("airports") List<String> airports,
    @JsonProperty("default_window_hours") long defaultWindowHours,
    @JsonProperty("max_window_hours") long maxWindowHours) {}
