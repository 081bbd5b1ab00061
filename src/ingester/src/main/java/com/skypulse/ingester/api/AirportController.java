package com.skypulse.ingester.api;

import com.skypulse.ingester.airport.AirportMovements;
import com.skypulse.ingester.airport.AirportTrafficService;
import java.time.Duration;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** On-demand airport movements. Each call is charged to the credit budget. */
@RestController
@RequestMapping("/api/airports")
public class AirportController {
  private final AirportTrafficService airportTrafficService;

  public AirportController(AirportTrafficService airportTrafficService) {
    this.airportTrafficService = airportTrafficService;
  }

  @GetMapping
  public AirportListResponse airports() {
    return new AirportListResponse(
        airportTrafficService.majorAirports(),
        airportTrafficService.defaultWindow().toHours(),
        airportTrafficService.maxWindow().toHours());
  }

  @GetMapping("/{icao}/arrivals")
  public AirportMovements arrivals(
      @PathVariable("icao") String icao,
      @RequestParam(value = "window", required = false) String window) {
    return airportTrafficService.arrivals(icao, parseWindow(window));
  }

  @GetMapping("/{icao}/departures")
  public AirportMovements departures(
      @PathVariable("icao") String icao,
      @RequestParam(value = "window", required = false) String window) {
    return airportTrafficService.departures(icao, parseWindow(window));
  }

  private Duration parseWindow(String raw) {
    return QueryParser.parseWindow(
        raw, airportTrafficService.defaultWindow(), airportTrafficService.maxWindow());
  }
}
