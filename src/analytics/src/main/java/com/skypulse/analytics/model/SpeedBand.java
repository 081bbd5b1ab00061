package com.skypulse.analytics.model;

/** Ground speed buckets in knots, lower bound inclusive. */
public enum SpeedBand {
  SLOW("Slow", 0),
  MEDIUM("Medium", 200),
  FAST("Fast", 350),
  VERY_FAST("Very Fast", 500);

  private final String label;
  private final double lowerBoundKnots;

  SpeedBand(String label, double lowerBoundKnots) {
    this.label = label;
    this.lowerBoundKnots = lowerBoundKnots;
  }

  public String label() {
    return label;
  }

  public static SpeedBand ofKnots(double speedKnots) {
    SpeedBand resolved = SLOW;
    for (SpeedBand band : values()) {
      if (speedKnots >= band.lowerBoundKnots) {
        resolved = band;
      }
    }
    return resolved;
  }
}
