package com.skypulse.analytics.transform;

import com.skypulse.analytics.model.FlightRecord;
import java.util.List;

/**
 * Output of one transform pass.
 *
 * @param records normalized records, unique by icao24
 * @param received rows present in the payload
 * @param dropped rows rejected as malformed or lacking both identity and position
 * @param duplicates rows superseded by a newer row for the same icao24
 */
public record TransformResult(List<FlightRecord> records, int received, int dropped, int duplicates) {
  public TransformResult {
    records = List.copyOf(records);
  }
}
