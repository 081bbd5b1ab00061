package com.skypulse.analytics.model;

/** Altitude buckets in feet, lower bound inclusive. */
public enum AltitudeBand {
  LOW("Low", Double.NEGATIVE_INFINITY),
  MEDIUM("Medium", 10_000),
  HIGH("High", 20_000),
  VERY_HIGH("Very High", 30_000),
  EXTREME("Extreme", 45_000);

  private final String label;
  private final double lowerBoundFt;

  AltitudeBand(String label, double lowerBoundFt) {
    this.label = label;
    this.lowerBoundFt = lowerBoundFt;
  }

  public String label() {
    return label;
  }

  public static AltitudeBand ofFeet(double altitudeFt) {
    AltitudeBand resolved = LOW;
    for (AltitudeBand band : values()) {
      if (altitudeFt >= band.lowerBoundFt) {
        resolved = band;
      }
    }
    return resolved;
  }
}
