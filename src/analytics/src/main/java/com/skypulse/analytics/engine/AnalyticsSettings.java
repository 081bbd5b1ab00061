package com.skypulse.analytics.engine;

import com.skypulse.analytics.model.WeightClass;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables for anomaly detection and traffic-flow bucketing.
 *
 * @param stdDevThreshold number of standard deviations beyond which a value is an outlier
 * @param minSamples minimum known values per weight class before outliers are evaluated
 * @param maxSpeedMps plausible speed ceiling per weight class
 * @param lowAltitudeRuleEnabled whether level airliners below {@code lowAltitudeThresholdM} are flagged
 * @param lowAltitudeThresholdM altitude floor for the low-altitude rule
 * @param compassSectors 8 or 16
 */
public record AnalyticsSettings(
    double stdDevThreshold,
    int minSamples,
    Map<WeightClass, Double> maxSpeedMps,
    boolean lowAltitudeRuleEnabled,
    double lowAltitudeThresholdM,
    int compassSectors) {

  public static final double DEFAULT_STD_DEV_THRESHOLD = 3.0;
  public static final int DEFAULT_MIN_SAMPLES = 10;
  public static final double DEFAULT_LOW_ALTITUDE_THRESHOLD_M = 1524.0;
  public static final int DEFAULT_COMPASS_SECTORS = 8;

  public AnalyticsSettings {
    if (!(stdDevThreshold > 0.0)) {
      throw new IllegalArgumentException("stdDevThreshold must be > 0");
    }
    if (minSamples < 2) {
      throw new IllegalArgumentException("minSamples must be >= 2");
    }
    Map<WeightClass, Double> limits = new EnumMap<>(defaultMaxSpeedMps());
    if (maxSpeedMps != null) {
      limits.putAll(maxSpeedMps);
    }
    maxSpeedMps = Map.copyOf(limits);
  }

  public static AnalyticsSettings defaults() {
    return new AnalyticsSettings(
        DEFAULT_STD_DEV_THRESHOLD,
        DEFAULT_MIN_SAMPLES,
        defaultMaxSpeedMps(),
        true,
        DEFAULT_LOW_ALTITUDE_THRESHOLD_M,
        DEFAULT_COMPASS_SECTORS);
  }

  public static Map<WeightClass, Double> defaultMaxSpeedMps() {
    Map<WeightClass, Double> limits = new EnumMap<>(WeightClass.class);
    limits.put(WeightClass.LIGHT, 120.0);
    limits.put(WeightClass.SMALL, 180.0);
    limits.put(WeightClass.LARGE, 320.0);
    limits.put(WeightClass.HEAVY, 330.0);
    limits.put(WeightClass.HIGH_PERF, 700.0);
    limits.put(WeightClass.ROTORCRAFT, 120.0);
    limits.put(WeightClass.UNKNOWN, 350.0);
    return limits;
  }

  public double maxSpeedFor(WeightClass weightClass) {
    return maxSpeedMps.get(weightClass);
  }
}
