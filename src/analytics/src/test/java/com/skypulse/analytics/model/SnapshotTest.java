package com.skypulse.analytics.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.skypulse.analytics.engine.AnalyticsEngine;
import com.skypulse.analytics.engine.AnalyticsSettings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SnapshotTest {

  @Test
  void ofSubstitutesFlaggedRecordsAndKeepsTransformOrder() {
    FlightRecord slow = record("bbb222", 100.0);
    FlightRecord tooFast = record("aaa111", 250.0);
    List<FlightRecord> records = List.of(slow, tooFast);
    AnalyticsResult aggregates = new AnalyticsEngine(AnalyticsSettings.defaults()).analyze(records);

    Snapshot snapshot = Snapshot.of("europe", Instant.parse("2026-01-01T00:00:00Z"), records, aggregates);

    assertThat(snapshot.records()).extracting(FlightRecord::icao24).containsExactly("bbb222", "aaa111");
    assertThat(snapshot.records()).extracting(FlightRecord::isAnomalous).containsExactly(false, true);
  }

  @Test
  void recordsAreImmutableOncePublished() {
    List<FlightRecord> records = new ArrayList<>(List.of(record("aaa111", 100.0)));
    AnalyticsResult aggregates = new AnalyticsEngine(AnalyticsSettings.defaults()).analyze(records);
    Snapshot snapshot = new Snapshot("europe", Instant.EPOCH, records, aggregates);

    records.clear();

    assertThat(snapshot.records()).hasSize(1);
    assertThatThrownBy(() -> snapshot.records().clear()).isInstanceOf(UnsupportedOperationException.class);
  }

  private static FlightRecord record(String icao24, double speedMps) {
    return new FlightRecord(
        icao24, "", "France", Optional.empty(), OptionalDouble.of(3000.0), OptionalDouble.of(speedMps),
        OptionalDouble.empty(), OptionalDouble.empty(), WeightClass.SMALL, FlightPhase.LEVEL, Set.of());
  }
}
