package com.skypulse.ingester.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.skypulse.analytics.model.AnalyticsResult;
import java.time.Instant;

public record AnalyticsResponse(
    @JsonProperty("region") String region,
    @JsonProperty("captured_at") Instant capturedAt,
    @JsonProperty("aggregates") AnalyticsResult aggregates) {}
