package com.skypulse.ingester.opensky;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skypulse.ingester.config.OpenSkyProperties;
import com.skypulse.ingester.region.BoundingBox;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the OpenSky data endpoints.
 *
 * <p>Every call carries a bearer token from {@link OpenSkyTokenService} and a per-request timeout.
 * Non-success responses are raised as {@link UpstreamTransportException}; callers decide whether to
 * keep serving older data.
 */
@Component
public class OpenSkyClient {
  private static final Logger log = LoggerFactory.getLogger(OpenSkyClient.class);
  private static final TypeReference<List<FlightMovement>> MOVEMENTS = new TypeReference<>() {};

  private final OpenSkyProperties properties;
  private final OpenSkyTokenService tokenService;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Timer statesRequestTimer;
  private final Counter statesRequestSuccessCounter;
  private final Counter statesRequestRateLimitedCounter;
  private final Counter statesRequestClientErrorCounter;
  private final Counter statesRequestServerErrorCounter;
  private final Counter statesRequestExceptionCounter;
  private final Timer flightsRequestTimer;
  private final AtomicInteger lastStatusCode = new AtomicInteger(0);

  public OpenSkyClient(
      OpenSkyProperties properties,
      OpenSkyTokenService tokenService,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock) {
    this.properties = properties;
    this.tokenService = tokenService;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clock = clock;

    this.statesRequestTimer = Timer.builder("ingester.opensky.states.http.duration")
        .description("OpenSky /states/all HTTP request duration (seconds)")
        .publishPercentileHistogram(true)
        .register(meterRegistry);
    // Outcome is the only tag; region and URL would multiply series.
    this.statesRequestSuccessCounter = statesCounter(meterRegistry, "success");
    this.statesRequestRateLimitedCounter = statesCounter(meterRegistry, "rate_limited");
    this.statesRequestClientErrorCounter = statesCounter(meterRegistry, "client_error");
    this.statesRequestServerErrorCounter = statesCounter(meterRegistry, "server_error");
    this.statesRequestExceptionCounter = statesCounter(meterRegistry, "exception");
    this.flightsRequestTimer = Timer.builder("ingester.opensky.flights.http.duration")
        .description("OpenSky /flights HTTP request duration (seconds)")
        .register(meterRegistry);

    meterRegistry.gauge("ingester.opensky.states.http.last_status", lastStatusCode);
  }

  private static Counter statesCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("ingester.opensky.states.http.requests.total")
        .description("OpenSky /states/all HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  /**
   * Fetches all state vectors inside the box. {@code extended=1} asks for the aircraft category
   * column.
   *
   * @throws OpenSkyAuthException when no token is available
   * @throws UpstreamTransportException on I/O errors, timeouts and non-2xx responses
   */
  public StatesResponse fetchStates(BoundingBox box) {
    String url = String.format(
        Locale.ROOT,
        "%s/states/all?lamin=%s&lamax=%s&lomin=%s&lomax=%s&extended=1",
        properties.baseUrl(), box.latMin(), box.latMax(), box.lonMin(), box.lonMax());

    HttpResponse<String> response;
    try {
      response = send(url, statesRequestTimer);
    } catch (UpstreamTransportException ex) {
      lastStatusCode.set(0);
      statesRequestExceptionCounter.increment();
      throw ex;
    }
    int status = response.statusCode();
    lastStatusCode.set(status);

    if (status == 429) {
      statesRequestRateLimitedCounter.increment();
      Long retryAfter = parseLong(response.headers().firstValue("X-Rate-Limit-Retry-After-Seconds"));
      log.warn("OpenSky rate limit hit (429), retry after {}s", retryAfter);
      throw new UpstreamTransportException("OpenSky rate limit exceeded", status, retryAfter);
    }
    if (status < 200 || status >= 300) {
      if (status >= 500) {
        statesRequestServerErrorCounter.increment();
      } else {
        statesRequestClientErrorCounter.increment();
      }
      if (status == 401) {
        tokenService.invalidate();
      }
      throw new UpstreamTransportException("OpenSky /states/all returned " + status, status, null);
    }
    statesRequestSuccessCounter.increment();
    Long remaining = parseLong(response.headers().firstValue("X-Rate-Limit-Remaining"));
    return new StatesResponse(
        response.body(), clock.instant(), remaining == null ? null : remaining.intValue());
  }

  public List<FlightMovement> fetchArrivals(String airport, Instant begin, Instant end) {
    return fetchMovements("arrival", airport, begin, end);
  }

  public List<FlightMovement> fetchDepartures(String airport, Instant begin, Instant end) {
    return fetchMovements("departure", airport, begin, end);
  }

  private List<FlightMovement> fetchMovements(String kind, String airport, Instant begin, Instant end) {
    String url = properties.baseUrl() + "/flights/" + kind
        + "?airport=" + URLEncoder.encode(airport, StandardCharsets.UTF_8)
        + "&begin=" + begin.getEpochSecond()
        + "&end=" + end.getEpochSecond();
    HttpResponse<String> response = send(url, flightsRequestTimer);
    int status = response.statusCode();
    // OpenSky answers 404 when no flight matched the interval.
    if (status == 404) {
      return List.of();
    }
    if (status == 429) {
      Long retryAfter = parseLong(response.headers().firstValue("X-Rate-Limit-Retry-After-Seconds"));
      throw new UpstreamTransportException("OpenSky rate limit exceeded", status, retryAfter);
    }
    if (status < 200 || status >= 300) {
      throw new UpstreamTransportException("OpenSky /flights/" + kind + " returned " + status, status, null);
    }
    String body = response.body();
    if (body == null || body.isBlank()) {
      return List.of();
    }
    try {
      List<FlightMovement> movements = objectMapper.readValue(body, MOVEMENTS);
      return movements == null ? List.of() : List.copyOf(movements);
    } catch (IOException ex) {
      throw new UpstreamTransportException("Unreadable /flights/" + kind + " response", ex);
    }
  }

  private HttpResponse<String> send(String url, Timer timer) {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .header("Authorization", "Bearer " + tokenService.getValidToken().value())
        .GET();
    if (properties.requestTimeoutMs() > 0) {
      builder.timeout(Duration.ofMillis(properties.requestTimeoutMs()));
    }

    long httpStartNs = System.nanoTime();
    try {
      return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException ex) {
      throw new UpstreamTransportException("OpenSky request timed out", ex);
    } catch (IOException ex) {
      throw new UpstreamTransportException("OpenSky request failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new UpstreamTransportException("OpenSky request interrupted", ex);
    } finally {
      timer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
    }
  }

  private Long parseLong(Optional<String> header) {
    if (header.isEmpty()) {
      return null;
    }
    try {
      return Long.parseLong(header.get().trim());
    } catch (NumberFormatException ex) {
      log.debug("Unable to parse rate limit header value: {}", header.get());
      return null;
    }
  }
}
