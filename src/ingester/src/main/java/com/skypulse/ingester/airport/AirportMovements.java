package com.skypulse.ingester.airport;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.skypulse.ingester.opensky.FlightMovement;
import java.time.Instant;
import java.util.List;

/** Arrivals or departures of one airport over a time window. */
public record AirportMovements(
    @JsonProperty("airport") String airport,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("begin") Instant begin,
    @JsonProperty("end") Instant end,
    @JsonProperty("flights") List<FlightMovement> flights) {

  public enum Direction {
    ARRIVALS,
    DEPARTURES
  }

  public AirportMovements {
    flights = List.copyOf(flights);
  }

  @JsonProperty("count")
  public int count() {
    return flights.size();
  }
}
