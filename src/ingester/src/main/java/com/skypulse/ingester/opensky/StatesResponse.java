package com.skypulse.ingester.opensky;

import java.time.Instant;

/**
 * Successful {@code /states/all} response.
 *
 * @param body raw JSON body, cached and handed to the transform stage as is
 * @param fetchedAt local time the response was received
 * @param remainingCredits {@code X-Rate-Limit-Remaining}, when present
 */
public record StatesResponse(String body, Instant fetchedAt, Integer remainingCredits) {}
