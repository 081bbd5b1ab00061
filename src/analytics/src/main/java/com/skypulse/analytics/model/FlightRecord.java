package com.skypulse.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Canonical flight record derived from one upstream state vector.
 *
 * <p>Measurements are {@link OptionalDouble}: an empty value means the upstream did not report it,
 * which is different from a reported zero.
 */
public record FlightRecord(
    @JsonProperty("icao24") String icao24,
    @JsonProperty("callsign") String callsign,
    @JsonProperty("country") String country,
    @JsonProperty("position") Optional<GeoPosition> position,
    @JsonProperty("altitude_m") OptionalDouble altitudeM,
    @JsonProperty("speed_mps") OptionalDouble speedMps,
    @JsonProperty("heading_deg") OptionalDouble headingDeg,
    @JsonProperty("vertical_rate_mps") OptionalDouble verticalRateMps,
    @JsonProperty("weight_class") WeightClass weightClass,
    @JsonProperty("flight_phase") FlightPhase flightPhase,
    @JsonProperty("anomaly_reasons") Set<String> anomalyReasons) {

  public static final double FEET_PER_METER = 3.28084;
  public static final double KNOTS_PER_MPS = 1.94384;

  public FlightRecord {
    Objects.requireNonNull(icao24, "icao24");
    callsign = callsign == null ? "" : callsign;
    country = country == null ? "Unknown" : country;
    position = position == null ? Optional.empty() : position;
    altitudeM = altitudeM == null ? OptionalDouble.empty() : altitudeM;
    speedMps = speedMps == null ? OptionalDouble.empty() : speedMps;
    headingDeg = headingDeg == null ? OptionalDouble.empty() : headingDeg;
    verticalRateMps = verticalRateMps == null ? OptionalDouble.empty() : verticalRateMps;
    weightClass = weightClass == null ? WeightClass.UNKNOWN : weightClass;
    flightPhase = flightPhase == null ? FlightPhase.LEVEL : flightPhase;
    anomalyReasons = anomalyReasons == null
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(anomalyReasons));
  }

  @JsonProperty("is_anomalous")
  public boolean isAnomalous() {
    return !anomalyReasons.isEmpty();
  }

  @JsonProperty("altitude_ft")
  public OptionalDouble altitudeFt() {
    return altitudeM.isPresent()
        ? OptionalDouble.of(altitudeM.getAsDouble() * FEET_PER_METER)
        : OptionalDouble.empty();
  }

  @JsonProperty("speed_knots")
  public OptionalDouble speedKnots() {
    return speedMps.isPresent()
        ? OptionalDouble.of(speedMps.getAsDouble() * KNOTS_PER_MPS)
        : OptionalDouble.empty();
  }

  @JsonProperty("altitude_band")
  public Optional<AltitudeBand> altitudeBand() {
    OptionalDouble feet = altitudeFt();
    return feet.isPresent() ? Optional.of(AltitudeBand.ofFeet(feet.getAsDouble())) : Optional.empty();
  }

  @JsonProperty("speed_band")
  public Optional<SpeedBand> speedBand() {
    OptionalDouble knots = speedKnots();
    return knots.isPresent() ? Optional.of(SpeedBand.ofKnots(knots.getAsDouble())) : Optional.empty();
  }

  /**
   * Returns a copy carrying the given anomaly reasons.
   *
   * @param reasons rule codes in firing order
   * @return flagged copy, or this record when there is nothing to add
   */
  public FlightRecord withAnomalyReasons(Set<String> reasons) {
    if (reasons == null || reasons.isEmpty()) {
      return this;
    }
    return new FlightRecord(
        icao24,
        callsign,
        country,
        position,
        altitudeM,
        speedMps,
        headingDeg,
        verticalRateMps,
        weightClass,
        flightPhase,
        reasons);
  }
}
