package com.skypulse.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable normalized dataset plus analytics for one region at one point in time.
 *
 * <p>{@code capturedAt} is the upstream fetch time and the only staleness signal consumers get.
 */
public record Snapshot(
    @JsonProperty("region") String region,
    @JsonProperty("captured_at") Instant capturedAt,
    @JsonProperty("records") List<FlightRecord> records,
    @JsonProperty("aggregates") AnalyticsResult aggregates) {

  public Snapshot {
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(capturedAt, "capturedAt");
    Objects.requireNonNull(aggregates, "aggregates");
    records = List.copyOf(records);
  }

  /**
   * Builds a snapshot whose records carry the anomaly flags found by the analytics pass.
   *
   * @param region region name
   * @param capturedAt upstream fetch time
   * @param records transformed records, in transform order
   * @param aggregates analytics computed over {@code records}
   * @return snapshot with flagged records substituted in place
   */
  public static Snapshot of(
      String region, Instant capturedAt, List<FlightRecord> records, AnalyticsResult aggregates) {
    Map<String, FlightRecord> flagged = new HashMap<>();
    for (FlightRecord anomaly : aggregates.anomalies()) {
      flagged.put(anomaly.icao24(), anomaly);
    }
    List<FlightRecord> merged = new ArrayList<>(records.size());
    for (FlightRecord record : records) {
      merged.add(flagged.getOrDefault(record.icao24(), record));
    }
    return new Snapshot(region, capturedAt, merged, aggregates);
  }
}
