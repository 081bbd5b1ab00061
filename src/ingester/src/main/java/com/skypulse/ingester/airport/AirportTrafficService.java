package com.skypulse.ingester.airport;

import com.skypulse.ingester.api.BadRequestException;
import com.skypulse.ingester.budget.BudgetDecision;
import com.skypulse.ingester.budget.CreditBudgetTracker;
import com.skypulse.ingester.config.IngesterProperties;
import com.skypulse.ingester.opensky.FlightMovement;
import com.skypulse.ingester.opensky.OpenSkyClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * On-demand airport arrivals and departures.
 *
 * <p>Each query is charged against the shared credit budget before the upstream call.
 */
@Service
public class AirportTrafficService {
  private static final Logger log = LoggerFactory.getLogger(AirportTrafficService.class);
  private static final Pattern ICAO_AIRPORT = Pattern.compile("^[A-Z]{4}$");
  static final Duration DEFAULT_WINDOW = Duration.ofHours(24);
  static final Duration MAX_WINDOW = Duration.ofDays(7);
  static final List<String> DEFAULT_MAJOR_AIRPORTS = List.of(
      "KJFK", "KLAX", "KORD", "KATL", "KDFW", "EGLL", "LFPG", "EDDF",
      "EHAM", "LEMD", "RJTT", "VHHH", "WSSS", "YSSY", "OMDB");

  private final OpenSkyClient client;
  private final CreditBudgetTracker budget;
  private final Clock clock;
  private final List<String> majorAirports;
  private final int queryCost;
  private final Duration maxWindow;

  public AirportTrafficService(
      OpenSkyClient client, CreditBudgetTracker budget, IngesterProperties properties, Clock clock) {
    this.client = client;
    this.budget = budget;
    this.clock = clock;
    IngesterProperties.Airports airports = properties.airports();
    this.majorAirports = airports == null || airports.major() == null || airports.major().isEmpty()
        ? DEFAULT_MAJOR_AIRPORTS
        : airports.major().stream().map(code -> code.trim().toUpperCase(Locale.ROOT)).toList();
    this.queryCost = airports != null && airports.queryCost() > 0 ? airports.queryCost() : 1;
    Duration configuredMax = airports != null && airports.maxWindowHours() > 0
        ? Duration.ofHours(airports.maxWindowHours())
        : MAX_WINDOW;
    this.maxWindow = configuredMax.compareTo(MAX_WINDOW) > 0 ? MAX_WINDOW : configuredMax;
  }

  public List<String> majorAirports() {
    return majorAirports;
  }

  public Duration defaultWindow() {
    return DEFAULT_WINDOW.compareTo(maxWindow) > 0 ? maxWindow : DEFAULT_WINDOW;
  }

  public Duration maxWindow() {
    return maxWindow;
  }

  public AirportMovements arrivals(String airport, Duration window) {
    return query(AirportMovements.Direction.ARRIVALS, airport, window);
  }

  public AirportMovements departures(String airport, Duration window) {
    return query(AirportMovements.Direction.DEPARTURES, airport, window);
  }

  private AirportMovements query(AirportMovements.Direction direction, String rawAirport, Duration window) {
    String airport = normalizeAirport(rawAirport);
    if (window == null || window.isZero() || window.isNegative()) {
      throw new BadRequestException("window must be > 0");
    }
    if (window.compareTo(maxWindow) > 0) {
      throw new BadRequestException("window exceeds maximum of " + maxWindow.toHours() + "h");
    }

    BudgetDecision decision = budget.authorize(queryCost);
    if (!decision.granted()) {
      long retryAfter = Math.max(1L, budget.untilNextRelease().toSeconds());
      log.warn("Airport query for {} denied by budget (consumed={}, limit={})",
          airport, decision.consumed(), decision.limit());
      throw new BudgetDeniedException("credit budget exhausted", retryAfter);
    }

    Instant end = clock.instant();
    Instant begin = end.minus(window);
    List<FlightMovement> flights = direction == AirportMovements.Direction.ARRIVALS
        ? client.fetchArrivals(airport, begin, end)
        : client.fetchDepartures(airport, begin, end);
    log.debug("Airport {} {}: {} flights over {}", airport, direction, flights.size(), window);
    return new AirportMovements(airport, direction, begin, end, flights);
  }

  static String normalizeAirport(String raw) {
    String airport = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    if (!ICAO_AIRPORT.matcher(airport).matches()) {
      throw new BadRequestException("airport must be a 4-letter ICAO code");
    }
    return airport;
  }
}
