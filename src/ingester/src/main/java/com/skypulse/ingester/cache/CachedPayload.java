package com.skypulse.ingester.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Raw upstream body as it was received.
 *
 * @param body unmodified {@code /states/all} JSON
 * @param fetchedAt time the response was received
 */
public record CachedPayload(
    @JsonProperty("body") String body,
    @JsonProperty("fetched_at") Instant fetchedAt) {}
