package com.skypulse.analytics.transform;

import com.skypulse.analytics.model.RawStateVector;
import java.util.List;

/**
 * Parsed {@code /states/all} payload.
 *
 * @param time upstream snapshot time in epoch seconds, may be {@code null}
 * @param states rows that parsed into state vectors
 * @param rejectedRows rows that were not arrays and were dropped
 */
public record RawPayload(Long time, List<RawStateVector> states, int rejectedRows) {
  public RawPayload {
    states = List.copyOf(states);
  }

  public int receivedRows() {
    return states.size() + rejectedRows;
  }
}
