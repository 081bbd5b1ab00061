package com.skypulse.ingester.opensky;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One flight from the OpenSky {@code /flights/*} endpoints.
 *
 * <p>Unknown fields are ignored to remain resilient to upstream schema changes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlightMovement(
    @JsonProperty("icao24") String icao24,
    @JsonProperty("callsign") String callsign,
    @JsonProperty("estDepartureAirport") String departureAirport,
    @JsonProperty("estArrivalAirport") String arrivalAirport,
    @JsonProperty("firstSeen") Long firstSeen,
    @JsonProperty("lastSeen") Long lastSeen) {

  public FlightMovement {
    callsign = callsign == null ? "" : callsign.trim();
  }
}
