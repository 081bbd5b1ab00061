package com.skypulse.analytics.model;

/** Aircraft weight buckets derived from the ADS-B emitter category or the ICAO type code. */
public enum WeightClass {
  LIGHT,
  SMALL,
  LARGE,
  HEAVY,
  HIGH_PERF,
  ROTORCRAFT,
  UNKNOWN
}
