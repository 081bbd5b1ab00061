package com.skypulse.ingester.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Read-only view of a region's fetch history.
 *
 * @param region region name
 * @param state current lifecycle state
 * @param lastOutcome {@code SUCCEEDED} or {@code FAILED} of the last finished attempt, null before
 *     the first one
 * @param lastAttemptAt start of the last attempt
 * @param lastSuccessAt completion of the last successful fetch
 * @param lastFailureReason short machine-readable reason of the last failure
 * @param consecutiveFailures failures since the last success
 * @param upstreamRemainingCredits {@code X-Rate-Limit-Remaining} of the last successful fetch
 */
public record RegionStatus(
    @JsonProperty("region") String region,
    @JsonProperty("state") RegionState state,
    @JsonProperty("last_outcome") RegionState lastOutcome,
    @JsonProperty("last_attempt_at") Instant lastAttemptAt,
    @JsonProperty("last_success_at") Instant lastSuccessAt,
    @JsonProperty("last_failure_reason") String lastFailureReason,
    @JsonProperty("consecutive_failures") int consecutiveFailures,
    @JsonProperty("upstream_remaining_credits") Integer upstreamRemainingCredits) {

  static RegionStatus idle(String region) {
    return new RegionStatus(region, RegionState.IDLE, null, null, null, null, 0, null);
  }

  RegionStatus attempting(Instant now) {
    return new RegionStatus(region, RegionState.AUTHORIZING, lastOutcome, now, lastSuccessAt,
        lastFailureReason, consecutiveFailures, upstreamRemainingCredits);
  }

  RegionStatus fetching() {
    return new RegionStatus(region, RegionState.FETCHING, lastOutcome, lastAttemptAt, lastSuccessAt,
        lastFailureReason, consecutiveFailures, upstreamRemainingCredits);
  }

  RegionStatus succeeded(Instant now, Integer remainingCredits) {
    return new RegionStatus(region, RegionState.IDLE, RegionState.SUCCEEDED, lastAttemptAt, now,
        null, 0, remainingCredits != null ? remainingCredits : upstreamRemainingCredits);
  }

  RegionStatus failed(String reason) {
    return new RegionStatus(region, RegionState.IDLE, RegionState.FAILED, lastAttemptAt, lastSuccessAt,
        reason, consecutiveFailures + 1, upstreamRemainingCredits);
  }
}
