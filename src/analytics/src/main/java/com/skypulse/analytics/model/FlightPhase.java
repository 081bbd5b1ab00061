package com.skypulse.analytics.model;

public enum FlightPhase {
  CLIMBING,
  DESCENDING,
  LEVEL,
  GROUND
}
