package com.skypulse.ingester.schedule;

/** Lifecycle of one region within a tick. SUCCEEDED and FAILED are reported as the last outcome. */
public enum RegionState {
  IDLE,
  AUTHORIZING,
  FETCHING,
  SUCCEEDED,
  FAILED
}
