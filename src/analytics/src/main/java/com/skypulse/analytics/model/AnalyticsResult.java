package com.skypulse.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Aggregates computed over one snapshot's record set.
 *
 * <p>Every distribution except {@code trafficFlow} sums to {@code totalCount}. Traffic flow only
 * counts records with a known heading.
 */
public record AnalyticsResult(
    @JsonProperty("total_count") int totalCount,
    @JsonProperty("climbing_count") int climbingCount,
    @JsonProperty("descending_count") int descendingCount,
    @JsonProperty("level_count") int levelCount,
    @JsonProperty("ground_count") int groundCount,
    @JsonProperty("positioned_count") int positionedCount,
    @JsonProperty("avg_altitude_m") OptionalDouble avgAltitudeM,
    @JsonProperty("avg_speed_mps") OptionalDouble avgSpeedMps,
    @JsonProperty("max_altitude_m") OptionalDouble maxAltitudeM,
    @JsonProperty("max_speed_mps") OptionalDouble maxSpeedMps,
    @JsonProperty("country_distribution") Map<String, Integer> countryDistribution,
    @JsonProperty("weight_class_distribution") Map<WeightClass, Integer> weightClassDistribution,
    @JsonProperty("flight_phase_distribution") Map<FlightPhase, Integer> flightPhaseDistribution,
    @JsonProperty("altitude_band_distribution") Map<String, Integer> altitudeBandDistribution,
    @JsonProperty("anomalies") List<FlightRecord> anomalies,
    @JsonProperty("traffic_flow") Map<String, Integer> trafficFlow) {

  @JsonProperty("anomaly_count")
  public int anomalyCount() {
    return anomalies.size();
  }
}
