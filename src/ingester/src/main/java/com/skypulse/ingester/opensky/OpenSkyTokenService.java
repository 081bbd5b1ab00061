package com.skypulse.ingester.opensky;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skypulse.ingester.config.ConfigurationException;
import com.skypulse.ingester.config.OpenSkyProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * OAuth2 client-credentials token manager for the OpenSky API.
 *
 * <p>Only one exchange is ever in flight: concurrent callers share a single
 * {@link CompletableFuture} and observe the same token or the same failure. Rejected credentials
 * (400/401/403) are latched and every later call fails fast without network I/O.
 */
@Component
public class OpenSkyTokenService {
  private static final Logger log = LoggerFactory.getLogger(OpenSkyTokenService.class);
  private static final long[] TOKEN_FAILURE_BACKOFF_SECONDS = {15L, 30L, 60L, 120L, 300L, 600L};
  static final long DEFAULT_EXPIRES_IN_SECONDS = 1800L;

  private final OpenSkyProperties properties;
  private final OpenSkyCredentialsProvider credentialsProvider;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Duration safetyMargin;
  private final Timer tokenRequestTimer;
  private final Counter tokenRequestSuccessCounter;
  private final Counter tokenRequestRejectedCounter;
  private final Counter tokenRequestServerErrorCounter;
  private final Counter tokenRequestExceptionCounter;

  private AccessToken token;
  private CompletableFuture<AccessToken> inFlight;
  private OpenSkyAuthException rejected;
  private int tokenFailureCount;
  private Instant nextTokenAttemptAt = Instant.EPOCH;

  public OpenSkyTokenService(
      OpenSkyProperties properties,
      OpenSkyCredentialsProvider credentialsProvider,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock) {
    this.properties = properties;
    this.credentialsProvider = credentialsProvider;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.safetyMargin = Duration.ofSeconds(Math.max(0L, properties.tokenSafetyMarginSeconds()));

    this.tokenRequestTimer = Timer.builder("ingester.opensky.token.http.duration")
        .description("OpenSky token HTTP request duration (seconds)")
        .publishPercentileHistogram(true)
        .register(meterRegistry);
    this.tokenRequestSuccessCounter = outcomeCounter(meterRegistry, "success");
    this.tokenRequestRejectedCounter = outcomeCounter(meterRegistry, "rejected");
    this.tokenRequestServerErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.tokenRequestExceptionCounter = outcomeCounter(meterRegistry, "exception");
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("ingester.opensky.token.http.requests.total")
        .description("OpenSky token HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  /**
   * Returns a token valid for at least the safety margin, exchanging credentials when needed.
   *
   * @throws OpenSkyAuthException when no token can be obtained; see {@link OpenSkyAuthException#isRetryable()}
   */
  public AccessToken getValidToken() {
    CompletableFuture<AccessToken> flight;
    boolean owner = false;
    synchronized (this) {
      Instant now = clock.instant();
      if (token != null && token.isUsableAt(now, safetyMargin)) {
        return token;
      }
      if (rejected != null) {
        throw rejected;
      }
      if (inFlight == null) {
        if (now.isBefore(nextTokenAttemptAt)) {
          long waitSeconds = Math.max(1L, Duration.between(now, nextTokenAttemptAt).toSeconds());
          throw new OpenSkyAuthException(
              "Token refresh cooldown active (" + waitSeconds + "s remaining)", true);
        }
        inFlight = new CompletableFuture<>();
        owner = true;
      }
      flight = inFlight;
    }
    return owner ? exchangeAndComplete(flight) : await(flight);
  }

  /** True once the token endpoint has rejected the configured credentials. */
  public synchronized boolean credentialsRejected() {
    return rejected != null;
  }

  /** Drops the cached token, e.g. after the data API answered 401. The rejection latch is kept. */
  public synchronized void invalidate() {
    token = null;
  }

  private AccessToken exchangeAndComplete(CompletableFuture<AccessToken> flight) {
    try {
      AccessToken fresh = exchange();
      synchronized (this) {
        token = fresh;
        tokenFailureCount = 0;
        nextTokenAttemptAt = Instant.EPOCH;
        inFlight = null;
      }
      flight.complete(fresh);
      return fresh;
    } catch (OpenSkyAuthException ex) {
      synchronized (this) {
        if (ex.isRetryable()) {
          armCooldown();
        } else {
          rejected = ex;
        }
        inFlight = null;
      }
      flight.completeExceptionally(ex);
      throw ex;
    } catch (RuntimeException ex) {
      tokenRequestExceptionCounter.increment();
      OpenSkyAuthException failure =
          new OpenSkyAuthException("Token exchange failed: " + ex.getMessage(), true, ex);
      synchronized (this) {
        armCooldown();
        inFlight = null;
      }
      flight.completeExceptionally(failure);
      throw failure;
    }
  }

  private AccessToken await(CompletableFuture<AccessToken> flight) {
    try {
      return flight.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new OpenSkyAuthException("Interrupted while waiting for token exchange", true, ex);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof OpenSkyAuthException authException) {
        throw authException;
      }
      throw new OpenSkyAuthException("Token exchange failed", true, ex.getCause());
    }
  }

  private AccessToken exchange() {
    OpenSkyCredentials credentials;
    try {
      credentials = credentialsProvider.get();
    } catch (ConfigurationException ex) {
      throw new OpenSkyAuthException(ex.getMessage(), false, ex);
    }

    String body = "grant_type=client_credentials"
        + "&client_id=" + URLEncoder.encode(credentials.clientId(), StandardCharsets.UTF_8)
        + "&client_secret=" + URLEncoder.encode(credentials.clientSecret(), StandardCharsets.UTF_8);
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(properties.tokenUrl()))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(body));
    if (properties.requestTimeoutMs() > 0) {
      builder.timeout(Duration.ofMillis(properties.requestTimeoutMs()));
    }

    long httpStartNs = System.nanoTime();
    HttpResponse<String> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      tokenRequestExceptionCounter.increment();
      throw new OpenSkyAuthException("Token request interrupted", true, ex);
    } catch (IOException ex) {
      tokenRequestExceptionCounter.increment();
      throw new OpenSkyAuthException("Token request failed: " + ex.getMessage(), true, ex);
    } finally {
      tokenRequestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
    }

    int status = response.statusCode();
    if (status == 400 || status == 401 || status == 403) {
      tokenRequestRejectedCounter.increment();
      log.error("OpenSky rejected the configured credentials (status={}); token refresh disabled", status);
      throw new OpenSkyAuthException("OpenSky credentials rejected: " + status, false);
    }
    if (status != 200) {
      tokenRequestServerErrorCounter.increment();
      throw new OpenSkyAuthException("Token endpoint returned " + status, true);
    }

    AccessToken fresh = parse(response.body());
    tokenRequestSuccessCounter.increment();
    log.info("OpenSky token refreshed, expires at {}", fresh.expiresAt());
    return fresh;
  }

  private AccessToken parse(String body) {
    try {
      JsonNode json = objectMapper.readTree(body);
      JsonNode value = json == null ? null : json.get("access_token");
      if (value == null || !value.isTextual() || value.asText().isBlank()) {
        tokenRequestExceptionCounter.increment();
        throw new OpenSkyAuthException("Token response has no access_token", true);
      }
      JsonNode expiresNode = json.get("expires_in");
      long expiresIn = expiresNode != null && expiresNode.canConvertToLong() && expiresNode.asLong() > 0
          ? expiresNode.asLong()
          : DEFAULT_EXPIRES_IN_SECONDS;
      Instant issuedAt = clock.instant();
      return new AccessToken(value.asText(), issuedAt, issuedAt.plusSeconds(expiresIn));
    } catch (IOException ex) {
      tokenRequestExceptionCounter.increment();
      throw new OpenSkyAuthException("Token response is not valid JSON", true, ex);
    }
  }

  private void armCooldown() {
    tokenFailureCount++;
    int index = Math.min(tokenFailureCount - 1, TOKEN_FAILURE_BACKOFF_SECONDS.length - 1);
    long cooldownSeconds = TOKEN_FAILURE_BACKOFF_SECONDS[index];
    nextTokenAttemptAt = clock.instant().plusSeconds(cooldownSeconds);
    log.warn("OpenSky token refresh failed (attempt {}), cooldown {}s", tokenFailureCount, cooldownSeconds);
  }
}
