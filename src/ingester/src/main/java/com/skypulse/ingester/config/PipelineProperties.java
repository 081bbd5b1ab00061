package com.skypulse.ingester.config;

import com.skypulse.analytics.engine.AnalyticsSettings;
import com.skypulse.analytics.model.WeightClass;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the transform and analytics stages.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code pipeline.*} prefix. Empty lookup tables fall back to the built-in defaults.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
  private final Anomaly anomaly = new Anomaly();
  private final Classification classification = new Classification();
  private final AircraftDb aircraftDb = new AircraftDb();
  private double climbThresholdMps = 2.5;
  private int compassSectors = AnalyticsSettings.DEFAULT_COMPASS_SECTORS;

  public Anomaly getAnomaly() {
    return anomaly;
  }

  public Classification getClassification() {
    return classification;
  }

  public AircraftDb getAircraftDb() {
    return aircraftDb;
  }

  public double getClimbThresholdMps() {
    return climbThresholdMps;
  }

  public void setClimbThresholdMps(double climbThresholdMps) {
    this.climbThresholdMps = climbThresholdMps;
  }

  public int getCompassSectors() {
    return compassSectors;
  }

  public void setCompassSectors(int compassSectors) {
    this.compassSectors = compassSectors;
  }

  /** Anomaly rule thresholds. */
  public static class Anomaly {
    private double stdDevThreshold = AnalyticsSettings.DEFAULT_STD_DEV_THRESHOLD;
    private int minSamples = AnalyticsSettings.DEFAULT_MIN_SAMPLES;
    private boolean lowAltitudeRuleEnabled = true;
    private double lowAltitudeThresholdM = AnalyticsSettings.DEFAULT_LOW_ALTITUDE_THRESHOLD_M;
    private Map<WeightClass, Double> maxSpeedMps = new LinkedHashMap<>();

    public double getStdDevThreshold() {
      return stdDevThreshold;
    }

    public void setStdDevThreshold(double stdDevThreshold) {
      this.stdDevThreshold = stdDevThreshold;
    }

    public int getMinSamples() {
      return minSamples;
    }

    public void setMinSamples(int minSamples) {
      this.minSamples = minSamples;
    }

    public boolean isLowAltitudeRuleEnabled() {
      return lowAltitudeRuleEnabled;
    }

    public void setLowAltitudeRuleEnabled(boolean lowAltitudeRuleEnabled) {
      this.lowAltitudeRuleEnabled = lowAltitudeRuleEnabled;
    }

    public double getLowAltitudeThresholdM() {
      return lowAltitudeThresholdM;
    }

    public void setLowAltitudeThresholdM(double lowAltitudeThresholdM) {
      this.lowAltitudeThresholdM = lowAltitudeThresholdM;
    }

    public Map<WeightClass, Double> getMaxSpeedMps() {
      return maxSpeedMps;
    }

    public void setMaxSpeedMps(Map<WeightClass, Double> maxSpeedMps) {
      this.maxSpeedMps = maxSpeedMps;
    }
  }

  /** Weight-class lookup tables keyed by OpenSky category code and ICAO type-code prefix. */
  public static class Classification {
    private Map<Integer, WeightClass> categories = new LinkedHashMap<>();
    private Map<String, WeightClass> typecodePrefixes = new LinkedHashMap<>();

    public Map<Integer, WeightClass> getCategories() {
      return categories;
    }

    public void setCategories(Map<Integer, WeightClass> categories) {
      this.categories = categories;
    }

    public Map<String, WeightClass> getTypecodePrefixes() {
      return typecodePrefixes;
    }

    public void setTypecodePrefixes(Map<String, WeightClass> typecodePrefixes) {
      this.typecodePrefixes = typecodePrefixes;
    }
  }

  /** Optional local SQLite aircraft reference DB used to resolve type codes. */
  public static class AircraftDb {
    private boolean enabled = false;
    private String path = "";
    private int cacheSize = 50000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public int getCacheSize() {
      return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
      this.cacheSize = cacheSize;
    }
  }
}
