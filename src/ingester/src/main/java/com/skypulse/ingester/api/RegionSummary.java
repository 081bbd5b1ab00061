package com.skypulse.ingester.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.skypulse.ingester.region.BoundingBox;
import com.skypulse.ingester.schedule.RegionStatus;
import java.time.Instant;

/** One entry of {@code GET /api/regions}. */
public record RegionSummary(
    @JsonProperty("name") String name,
    @JsonProperty("bounding_box") BoundingBox boundingBox,
    @JsonProperty("estimated_credit_cost") int estimatedCreditCost,
    @JsonProperty("status") RegionStatus status,
    @JsonProperty("snapshot_captured_at") Instant snapshotCapturedAt) {}
