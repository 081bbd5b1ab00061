package com.skypulse.ingester.opensky;

import java.time.Duration;
import java.time.Instant;

/**
 * Bearer token with its validity window. Replaced on refresh, never mutated.
 *
 * @param value raw bearer token
 * @param issuedAt local time the exchange completed
 * @param expiresAt {@code issuedAt + expires_in}
 */
public record AccessToken(String value, Instant issuedAt, Instant expiresAt) {
  /**
   * A token is usable while {@code now < expiresAt - margin}. The margin is capped at half the
   * token lifetime.
   */
  public boolean isUsableAt(Instant now, Duration safetyMargin) {
    Duration lifetime = Duration.between(issuedAt, expiresAt);
    Duration margin = safetyMargin.compareTo(lifetime.dividedBy(2)) > 0 ? lifetime.dividedBy(2) : safetyMargin;
    return now.isBefore(expiresAt.minus(margin));
  }

  @Override
  public String toString() {
    return "AccessToken[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
  }
}
