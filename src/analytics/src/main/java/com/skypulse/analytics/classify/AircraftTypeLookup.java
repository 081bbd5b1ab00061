package com.skypulse.analytics.classify;

import java.util.Optional;

/** Resolves the ICAO aircraft type code (for example {@code A320}) of a transponder address. */
@FunctionalInterface
public interface AircraftTypeLookup {
  /**
   * Returns the type code registered for an aircraft.
   *
   * @param icao24 aircraft ICAO24 (hex, case-insensitive)
   * @return type code when known
   */
  Optional<String> typecodeFor(String icao24);

  static AircraftTypeLookup none() {
    return icao24 -> Optional.empty();
  }
}
