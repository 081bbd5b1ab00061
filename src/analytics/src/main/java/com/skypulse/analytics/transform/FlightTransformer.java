package com.skypulse.analytics.transform;

import com.skypulse.analytics.classify.WeightClassifier;
import com.skypulse.analytics.model.FlightPhase;
import com.skypulse.analytics.model.FlightRecord;
import com.skypulse.analytics.model.GeoPosition;
import com.skypulse.analytics.model.RawStateVector;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes raw state vectors into canonical {@link FlightRecord}s.
 *
 * <p>Pure and deterministic: the output depends only on the input rows, the classifier tables and
 * the climb threshold. Upstream {@code null} is carried as an unknown value, never as zero.
 */
public class FlightTransformer {
  private static final Logger log = LoggerFactory.getLogger(FlightTransformer.class);
  static final String UNKNOWN_COUNTRY = "Unknown";
  static final String ROW_KEY_PREFIX = "~row";

  private final WeightClassifier weightClassifier;
  private final double climbThresholdMps;

  public FlightTransformer(WeightClassifier weightClassifier, double climbThresholdMps) {
    if (!(climbThresholdMps >= 0.0)) {
      throw new IllegalArgumentException("climb threshold must be >= 0");
    }
    this.weightClassifier = weightClassifier;
    this.climbThresholdMps = climbThresholdMps;
  }

  public TransformResult transform(RawPayload payload) {
    int dropped = payload.rejectedRows();
    int duplicates = 0;

    // Keep the freshest row per aircraft; first seen order is preserved.
    Map<String, RawStateVector> latestByIcao24 = new LinkedHashMap<>();
    int index = 0;
    for (RawStateVector vector : payload.states()) {
      String icao24 = normalizeIcao24(vector.icao24());
      if (icao24 == null) {
        if (position(vector.latitude(), vector.longitude()).isEmpty()) {
          dropped++;
          log.debug("Dropping state vector without icao24 or position at row {}", index);
          index++;
          continue;
        }
        icao24 = rowKey(index);
      }
      RawStateVector existing = latestByIcao24.get(icao24);
      if (existing != null) {
        duplicates++;
        if (isNewer(vector, existing)) {
          latestByIcao24.put(icao24, vector);
        }
      } else {
        latestByIcao24.put(icao24, vector);
      }
      index++;
    }

    List<FlightRecord> records = new ArrayList<>(latestByIcao24.size());
    for (Map.Entry<String, RawStateVector> entry : latestByIcao24.entrySet()) {
      try {
        records.add(toRecord(entry.getKey(), entry.getValue()));
      } catch (RuntimeException ex) {
        dropped++;
        log.warn("Dropping state vector {}: {}", entry.getKey(), ex.getMessage());
      }
    }
    return new TransformResult(records, payload.receivedRows(), dropped, duplicates);
  }

  FlightRecord toRecord(String icao24, RawStateVector vector) {
    OptionalDouble verticalRate = known(vector.verticalRate());
    return new FlightRecord(
        icao24,
        vector.callsign() == null ? "" : vector.callsign().trim(),
        normalizeCountry(vector.originCountry()),
        position(vector.latitude(), vector.longitude()),
        altitude(vector),
        speed(vector.velocity()),
        heading(vector.trueTrack()),
        verticalRate,
        weightClassifier.classify(vector),
        phase(vector.onGround(), verticalRate),
        Set.of());
  }

  FlightPhase phase(Boolean onGround, OptionalDouble verticalRate) {
    if (Boolean.TRUE.equals(onGround)) {
      return FlightPhase.GROUND;
    }
    if (verticalRate.isEmpty()) {
      return FlightPhase.LEVEL;
    }
    double rate = verticalRate.getAsDouble();
    if (rate > climbThresholdMps) {
      return FlightPhase.CLIMBING;
    }
    if (rate < -climbThresholdMps) {
      return FlightPhase.DESCENDING;
    }
    return FlightPhase.LEVEL;
  }

  private static boolean isNewer(RawStateVector candidate, RawStateVector current) {
    if (candidate.lastContact() == null) {
      return false;
    }
    return current.lastContact() == null || candidate.lastContact() > current.lastContact();
  }

  /**
   * Key for a positioned row that has no icao24. The {@code ~} prefix cannot occur in a hex
   * transponder address, so derived keys never collide with real ones.
   */
  static String rowKey(int rowIndex) {
    return ROW_KEY_PREFIX + rowIndex;
  }

  private static String normalizeIcao24(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return raw.trim().toLowerCase(Locale.ROOT);
  }

  private static String normalizeCountry(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN_COUNTRY;
    }
    return raw.trim();
  }

  private static Optional<GeoPosition> position(Double lat, Double lon) {
    OptionalDouble latitude = known(lat);
    OptionalDouble longitude = known(lon);
    if (latitude.isEmpty() || longitude.isEmpty()) {
      return Optional.empty();
    }
    double latValue = latitude.getAsDouble();
    double lonValue = longitude.getAsDouble();
    if (latValue < -90.0 || latValue > 90.0 || lonValue < -180.0 || lonValue > 180.0) {
      return Optional.empty();
    }
    return Optional.of(new GeoPosition(latValue, lonValue));
  }

  private static OptionalDouble altitude(RawStateVector vector) {
    OptionalDouble baro = known(vector.baroAltitude());
    return baro.isPresent() ? baro : known(vector.geoAltitude());
  }

  private static OptionalDouble speed(Double velocity) {
    OptionalDouble speed = known(velocity);
    if (speed.isPresent() && speed.getAsDouble() < 0.0) {
      return OptionalDouble.empty();
    }
    return speed;
  }

  private static OptionalDouble heading(Double trueTrack) {
    OptionalDouble heading = known(trueTrack);
    if (heading.isEmpty()) {
      return heading;
    }
    double normalized = heading.getAsDouble() % 360.0;
    if (normalized < 0) {
      normalized += 360.0;
    }
    return OptionalDouble.of(normalized);
  }

  static OptionalDouble known(Double value) {
    if (value == null || !Double.isFinite(value)) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(value);
  }
}
