package com.skypulse.ingester.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skypulse.analytics.classify.WeightClassifier;
import com.skypulse.analytics.engine.AnalyticsEngine;
import com.skypulse.analytics.engine.AnalyticsSettings;
import com.skypulse.analytics.model.Snapshot;
import com.skypulse.analytics.transform.FlightTransformer;
import com.skypulse.analytics.transform.StateVectorParser;
import com.skypulse.analytics.transform.TransformPipeline;
import com.skypulse.ingester.MutableClock;
import com.skypulse.ingester.budget.CreditBudgetTracker;
import com.skypulse.ingester.cache.CachedPayload;
import com.skypulse.ingester.cache.InMemoryRawResponseCache;
import com.skypulse.ingester.config.IngesterProperties;
import com.skypulse.ingester.opensky.OpenSkyClient;
import com.skypulse.ingester.opensky.OpenSkyTokenService;
import com.skypulse.ingester.opensky.StatesResponse;
import com.skypulse.ingester.opensky.UpstreamTransportException;
import com.skypulse.ingester.region.BoundingBox;
import com.skypulse.ingester.region.Region;
import com.skypulse.ingester.region.RegionCatalog;
import com.skypulse.ingester.snapshot.SnapshotStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RegionFetchSchedulerTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Region PARIS = new Region("paris", new BoundingBox(48.0, 49.5, 1.5, 3.5));
  private static final Region LYON = new Region("lyon", new BoundingBox(45.0, 46.5, 4.0, 5.5));
  private static final String PAYLOAD = """
      {"time":1714557600,"states":[
        ["39de4f","AFR1234 ","France",1714557590,1714557595,2.35,48.85,11000.0,false,230.0,90.0,0.0,null,11100.0,"1000",false,0,4],
        ["3c6444","DLH9LF  ","Germany",1714557590,1714557595,2.60,48.90,null,false,120.0,270.0,-6.0,null,null,"2000",false,0,3],
        ["4ca7b5","RYR88   ","Ireland",1714557590,1714557595,2.55,49.00,0.0,true,5.0,10.0,null,null,null,"3000",false,0,3]
      ]}
      """;

  private final MutableClock clock = new MutableClock(T0);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private OpenSkyClient client;
  private OpenSkyTokenService tokenService;
  private SnapshotStore store;
  private InMemoryRawResponseCache rawCache;
  private CreditBudgetTracker budget;

  @BeforeEach
  void setUp() {
    client = mock(OpenSkyClient.class);
    tokenService = mock(OpenSkyTokenService.class);
    store = new SnapshotStore(meterRegistry);
    rawCache = new InMemoryRawResponseCache(Duration.ofSeconds(300), clock);
  }

  private RegionFetchScheduler scheduler(long dailyLimit, Executor executor, Region... regions) {
    IngesterProperties properties = new IngesterProperties(
        60_000L, 0L, 2,
        new IngesterProperties.Budget(dailyLimit, 24, 50, 80, 95),
        List.of(), null, null);
    budget = new CreditBudgetTracker(properties, meterRegistry, clock);
    TransformPipeline pipeline = new TransformPipeline(
        new StateVectorParser(new ObjectMapper()),
        new FlightTransformer(WeightClassifier.withDefaults(), 2.5));
    return new RegionFetchScheduler(
        new RegionCatalog(List.of(regions)),
        budget,
        client,
        tokenService,
        pipeline,
        new AnalyticsEngine(AnalyticsSettings.defaults()),
        store,
        rawCache,
        meterRegistry,
        clock,
        executor);
  }

  private void respond(Region region, Instant fetchedAt) {
    when(client.fetchStates(region.boundingBox())).thenReturn(new StatesResponse(PAYLOAD, fetchedAt, 3990));
  }

  @Test
  void successfulTickPublishesSnapshotAndCachesPayload() {
    respond(PARIS, T0);
    RegionFetchScheduler scheduler = scheduler(100, Runnable::run, PARIS);

    scheduler.tick();

    Snapshot snapshot = store.current("paris").orElseThrow();
    assertThat(snapshot.capturedAt()).isEqualTo(T0);
    assertThat(snapshot.records()).hasSize(3);
    assertThat(snapshot.aggregates().groundCount()).isEqualTo(1);
    assertThat(rawCache.latest("paris")).map(CachedPayload::body).contains(PAYLOAD);

    RegionStatus status = scheduler.status("paris").orElseThrow();
    assertThat(status.state()).isEqualTo(RegionState.IDLE);
    assertThat(status.lastOutcome()).isEqualTo(RegionState.SUCCEEDED);
    assertThat(status.upstreamRemainingCredits()).isEqualTo(3990);
    assertThat(budget.state().consumed()).isEqualTo(1);
  }

  @Test
  void failedTickKeepsPreviousSnapshotAndSpentCredit() {
    RegionFetchScheduler scheduler = scheduler(100, Runnable::run, PARIS);
    respond(PARIS, T0);
    scheduler.tick();
    Snapshot previous = store.current("paris").orElseThrow();

    clock.advance(Duration.ofSeconds(60));
    when(client.fetchStates(PARIS.boundingBox()))
        .thenThrow(new UpstreamTransportException("OpenSky request timed out", new HttpTimeoutException("timeout")));
    scheduler.tick();

    assertThat(store.current("paris")).containsSame(previous);
    RegionStatus status = scheduler.status("paris").orElseThrow();
    assertThat(status.lastOutcome()).isEqualTo(RegionState.FAILED);
    assertThat(status.lastFailureReason()).isEqualTo(RegionFetchScheduler.REASON_TRANSPORT);
    assertThat(status.consecutiveFailures()).isEqualTo(1);
    assertThat(status.lastSuccessAt()).isEqualTo(T0);
    assertThat(budget.state().consumed()).isEqualTo(2);
  }

  @Test
  void rateLimitIsReportedAsSuch() {
    when(client.fetchStates(PARIS.boundingBox()))
        .thenThrow(new UpstreamTransportException("OpenSky rate limit exceeded", 429, 30L));
    RegionFetchScheduler scheduler = scheduler(100, Runnable::run, PARIS);

    scheduler.tick();

    assertThat(scheduler.status("paris").orElseThrow().lastFailureReason())
        .isEqualTo(RegionFetchScheduler.REASON_RATE_LIMITED);
    assertThat(store.current("paris")).isEmpty();
  }

  @Test
  void earlierRegionsWinWhenBudgetRunsLow() {
    respond(PARIS, T0);
    RegionFetchScheduler scheduler = scheduler(1, Runnable::run, PARIS, LYON);

    scheduler.tick();

    verify(client).fetchStates(PARIS.boundingBox());
    verify(client, never()).fetchStates(LYON.boundingBox());
    RegionStatus lyon = scheduler.status("lyon").orElseThrow();
    assertThat(lyon.lastOutcome()).isEqualTo(RegionState.FAILED);
    assertThat(lyon.lastFailureReason()).isEqualTo(RegionFetchScheduler.REASON_BUDGET_DENIED);
    assertThat(budget.state().consumed()).isEqualTo(1);
  }

  @Test
  void deniedRegionWithoutSnapshotIsRebuiltFromCache() {
    Instant cachedAt = T0.minusSeconds(120);
    rawCache.put("lyon", new CachedPayload(PAYLOAD, cachedAt));
    respond(PARIS, T0);
    RegionFetchScheduler scheduler = scheduler(1, Runnable::run, PARIS, LYON);

    scheduler.tick();

    Snapshot lyon = store.current("lyon").orElseThrow();
    assertThat(lyon.capturedAt()).isEqualTo(cachedAt);
    assertThat(lyon.records()).hasSize(3);
  }

  @Test
  void firstTickServesCachedSnapshotUntilFetchCompletes() {
    Instant cachedAt = T0.minusSeconds(120);
    rawCache.put("paris", new CachedPayload(PAYLOAD, cachedAt));
    respond(PARIS, T0);
    List<Runnable> pending = new ArrayList<>();
    RegionFetchScheduler scheduler = scheduler(100, pending::add, PARIS);

    scheduler.tick();

    assertThat(store.current("paris")).map(Snapshot::capturedAt).contains(cachedAt);
    assertThat(meterRegistry.get("ingester.fetch.cache_fallback.total").counter().count()).isEqualTo(1.0);

    pending.get(0).run();

    assertThat(store.current("paris")).map(Snapshot::capturedAt).contains(T0);
  }

  @Test
  void failureInOneRegionDoesNotAffectAnother() {
    when(client.fetchStates(PARIS.boundingBox())).thenThrow(new IllegalStateException("boom"));
    respond(LYON, T0);
    RegionFetchScheduler scheduler = scheduler(100, Runnable::run, PARIS, LYON);

    scheduler.tick();

    assertThat(scheduler.status("paris").orElseThrow().lastFailureReason())
        .isEqualTo(RegionFetchScheduler.REASON_INTERNAL);
    assertThat(store.current("lyon")).isPresent();
  }

  @Test
  void malformedPayloadFailsRegion() {
    when(client.fetchStates(PARIS.boundingBox())).thenReturn(new StatesResponse("<html>", T0, null));
    RegionFetchScheduler scheduler = scheduler(100, Runnable::run, PARIS);

    scheduler.tick();

    assertThat(scheduler.status("paris").orElseThrow().lastFailureReason())
        .isEqualTo(RegionFetchScheduler.REASON_MALFORMED);
  }

  @Test
  void regionStillInFlightIsSkippedWithoutSpendingCredit() {
    respond(PARIS, T0);
    List<Runnable> pending = new ArrayList<>();
    RegionFetchScheduler scheduler = scheduler(100, pending::add, PARIS);

    scheduler.tick();
    assertThat(scheduler.status("paris").orElseThrow().state()).isEqualTo(RegionState.FETCHING);
    scheduler.tick();

    assertThat(pending).hasSize(1);
    assertThat(budget.state().consumed()).isEqualTo(1);

    pending.get(0).run();
    scheduler.tick();
    assertThat(pending).hasSize(2);
    assertThat(budget.state().consumed()).isEqualTo(2);
  }

  @Test
  void rejectedCredentialsStopFetchingWithoutSpendingCredit() {
    when(tokenService.credentialsRejected()).thenReturn(true);
    RegionFetchScheduler scheduler = scheduler(100, Runnable::run, PARIS);

    scheduler.tick();

    verify(client, never()).fetchStates(any(BoundingBox.class));
    assertThat(budget.state().consumed()).isZero();
    assertThat(scheduler.status("paris").orElseThrow().lastFailureReason())
        .isEqualTo(RegionFetchScheduler.REASON_CREDENTIALS_REJECTED);
  }

  @Test
  void statusesFollowCatalogOrder() {
    RegionFetchScheduler scheduler = scheduler(100, Runnable::run, LYON, PARIS);

    assertThat(scheduler.statuses()).extracting(RegionStatus::region).containsExactly("lyon", "paris");
    assertThat(scheduler.statuses()).allSatisfy(status -> assertThat(status.state()).isEqualTo(RegionState.IDLE));
    verify(client, times(0)).fetchStates(any(BoundingBox.class));
  }
}
