package com.skypulse.analytics.engine;

import com.skypulse.analytics.model.AltitudeBand;
import com.skypulse.analytics.model.AnalyticsResult;
import com.skypulse.analytics.model.FlightPhase;
import com.skypulse.analytics.model.FlightRecord;
import com.skypulse.analytics.model.WeightClass;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Computes single-snapshot aggregates, anomaly flags and traffic flow.
 *
 * <p>Records are sorted by icao24 before any arithmetic, so every result (including floating point
 * sums) is independent of input order. No state is carried between calls.
 */
public class AnalyticsEngine {
  public static final String SPEED_EXCEEDS_CLASS_MAX = "speed_exceeds_class_max";
  public static final String ALTITUDE_OUTLIER = "altitude_outlier";
  public static final String SPEED_OUTLIER = "speed_outlier";
  public static final String LOW_ALTITUDE_AIRLINER = "low_altitude_airliner";
  static final String UNKNOWN_BAND = "Unknown";

  private static final Set<WeightClass> AIRLINER_CLASSES =
      EnumSet.of(WeightClass.SMALL, WeightClass.LARGE, WeightClass.HEAVY);

  private final AnalyticsSettings settings;
  private final CompassSectors sectors;

  public AnalyticsEngine(AnalyticsSettings settings) {
    this.settings = settings;
    this.sectors = new CompassSectors(settings.compassSectors());
  }

  public AnalyticsResult analyze(List<FlightRecord> records) {
    List<FlightRecord> ordered = new ArrayList<>(records);
    ordered.sort(Comparator.comparing(FlightRecord::icao24));

    Map<FlightPhase, Integer> phases = enumCounts(FlightPhase.class);
    Map<WeightClass, Integer> weightClasses = enumCounts(WeightClass.class);
    Map<String, Integer> countries = new TreeMap<>();
    Map<String, Integer> altitudeBands = new LinkedHashMap<>();
    for (AltitudeBand band : AltitudeBand.values()) {
      altitudeBands.put(band.label(), 0);
    }
    altitudeBands.put(UNKNOWN_BAND, 0);
    Map<String, Integer> trafficFlow = new LinkedHashMap<>();
    sectors.labels().forEach(label -> trafficFlow.put(label, 0));

    int positioned = 0;
    Accumulator altitude = new Accumulator();
    Accumulator speed = new Accumulator();

    for (FlightRecord record : ordered) {
      phases.merge(record.flightPhase(), 1, Integer::sum);
      weightClasses.merge(record.weightClass(), 1, Integer::sum);
      countries.merge(record.country(), 1, Integer::sum);
      altitudeBands.merge(
          record.altitudeBand().map(AltitudeBand::label).orElse(UNKNOWN_BAND), 1, Integer::sum);
      if (record.position().isPresent()) {
        positioned++;
      }
      if (record.headingDeg().isPresent()) {
        trafficFlow.merge(sectors.sectorOf(record.headingDeg().getAsDouble()), 1, Integer::sum);
      }
      altitude.add(record.altitudeM());
      speed.add(record.speedMps());
    }

    List<FlightRecord> anomalies = detectAnomalies(ordered);

    return new AnalyticsResult(
        ordered.size(),
        phases.get(FlightPhase.CLIMBING),
        phases.get(FlightPhase.DESCENDING),
        phases.get(FlightPhase.LEVEL),
        phases.get(FlightPhase.GROUND),
        positioned,
        altitude.mean(),
        speed.mean(),
        altitude.max(),
        speed.max(),
        Collections.unmodifiableMap(countries),
        Collections.unmodifiableMap(weightClasses),
        Collections.unmodifiableMap(phases),
        Collections.unmodifiableMap(altitudeBands),
        List.copyOf(anomalies),
        Collections.unmodifiableMap(trafficFlow));
  }

  /**
   * Flags records in icao24 order. Returned records are copies carrying their anomaly reasons.
   */
  List<FlightRecord> detectAnomalies(List<FlightRecord> ordered) {
    Map<WeightClass, ClassStats> altitudeStats = statsByClass(ordered, FlightRecord::altitudeM);
    Map<WeightClass, ClassStats> speedStats = statsByClass(ordered, FlightRecord::speedMps);

    List<FlightRecord> flagged = new ArrayList<>();
    for (FlightRecord record : ordered) {
      Set<String> reasons = new LinkedHashSet<>();
      if (record.speedMps().isPresent()
          && record.speedMps().getAsDouble() > settings.maxSpeedFor(record.weightClass())) {
        reasons.add(SPEED_EXCEEDS_CLASS_MAX);
      }
      if (record.flightPhase() != FlightPhase.GROUND) {
        if (isOutlier(record.altitudeM(), altitudeStats.get(record.weightClass()))) {
          reasons.add(ALTITUDE_OUTLIER);
        }
        if (isOutlier(record.speedMps(), speedStats.get(record.weightClass()))) {
          reasons.add(SPEED_OUTLIER);
        }
      }
      if (settings.lowAltitudeRuleEnabled()
          && record.flightPhase() == FlightPhase.LEVEL
          && AIRLINER_CLASSES.contains(record.weightClass())
          && record.altitudeM().isPresent()
          && record.altitudeM().getAsDouble() < settings.lowAltitudeThresholdM()) {
        reasons.add(LOW_ALTITUDE_AIRLINER);
      }
      if (!reasons.isEmpty()) {
        flagged.add(record.withAnomalyReasons(reasons));
      }
    }
    return flagged;
  }

  private boolean isOutlier(OptionalDouble value, ClassStats stats) {
    if (value.isEmpty() || stats == null) {
      return false;
    }
    if (stats.count() < settings.minSamples() || stats.stdDev() <= 0.0) {
      return false;
    }
    return Math.abs(value.getAsDouble() - stats.mean()) > settings.stdDevThreshold() * stats.stdDev();
  }

  // Baselines use airborne aircraft only; parked traffic would drag altitude means to zero.
  private static Map<WeightClass, ClassStats> statsByClass(
      List<FlightRecord> ordered, Function<FlightRecord, OptionalDouble> field) {
    Map<WeightClass, Accumulator> accumulators = new EnumMap<>(WeightClass.class);
    for (FlightRecord record : ordered) {
      if (record.flightPhase() == FlightPhase.GROUND) {
        continue;
      }
      accumulators.computeIfAbsent(record.weightClass(), ignored -> new Accumulator())
          .add(field.apply(record));
    }
    Map<WeightClass, ClassStats> stats = new EnumMap<>(WeightClass.class);
    accumulators.forEach((weightClass, acc) -> stats.put(weightClass, acc.stats()));
    return stats;
  }

  private static <E extends Enum<E>> Map<E, Integer> enumCounts(Class<E> type) {
    Map<E, Integer> counts = new EnumMap<>(type);
    for (E value : type.getEnumConstants()) {
      counts.put(value, 0);
    }
    return counts;
  }

  /**
   * Population statistics of one weight class.
   *
   * @param count number of known values
   * @param mean arithmetic mean
   * @param stdDev population standard deviation
   */
  record ClassStats(int count, double mean, double stdDev) {}

  private static final class Accumulator {
    private final List<Double> values = new ArrayList<>();

    void add(OptionalDouble value) {
      if (value.isPresent()) {
        values.add(value.getAsDouble());
      }
    }

    OptionalDouble mean() {
      if (values.isEmpty()) {
        return OptionalDouble.empty();
      }
      return OptionalDouble.of(sum() / values.size());
    }

    OptionalDouble max() {
      return values.stream().mapToDouble(Double::doubleValue).max();
    }

    ClassStats stats() {
      if (values.isEmpty()) {
        return new ClassStats(0, 0.0, 0.0);
      }
      double mean = sum() / values.size();
      double squares = 0.0;
      for (double value : values) {
        squares += (value - mean) * (value - mean);
      }
      return new ClassStats(values.size(), mean, Math.sqrt(squares / values.size()));
    }

    private double sum() {
      double sum = 0.0;
      for (double value : values) {
        sum += value;
      }
      return sum;
    }
  }
}
