package com.skypulse.ingester.schedule;

import com.skypulse.analytics.engine.AnalyticsEngine;
import com.skypulse.analytics.model.AnalyticsResult;
import com.skypulse.analytics.model.Snapshot;
import com.skypulse.analytics.transform.MalformedPayloadException;
import com.skypulse.analytics.transform.TransformPipeline;
import com.skypulse.analytics.transform.TransformResult;
import com.skypulse.ingester.budget.BudgetDecision;
import com.skypulse.ingester.budget.CreditBudgetTracker;
import com.skypulse.ingester.cache.CachedPayload;
import com.skypulse.ingester.cache.RawResponseCache;
import com.skypulse.ingester.config.ConfigurationException;
import com.skypulse.ingester.config.IngesterProperties;
import com.skypulse.ingester.config.OpenSkyProperties;
import com.skypulse.ingester.opensky.OpenSkyAuthException;
import com.skypulse.ingester.opensky.OpenSkyClient;
import com.skypulse.ingester.opensky.OpenSkyTokenService;
import com.skypulse.ingester.opensky.StatesResponse;
import com.skypulse.ingester.opensky.UpstreamTransportException;
import com.skypulse.ingester.region.Region;
import com.skypulse.ingester.region.RegionCatalog;
import com.skypulse.ingester.snapshot.SnapshotStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Periodic per-region fetch loop.
 *
 * <p>Each tick authorizes regions in catalog order against the credit budget and hands granted
 * regions to the worker pool, so a slow region never delays another. A failed or denied region
 * keeps serving its previous snapshot; when it has none yet, the newest cached raw response is
 * used to build one.
 *
 * <p>The first tick also restores snapshots from the raw cache before dispatching any fetch. This
 * only matters for a cache that outlives the process (the Redis backend): the in-memory cache is
 * empty at startup and is written on the same path that publishes, so it never holds a payload
 * for a region without a snapshot.
 */
@Component
public class RegionFetchScheduler {
  private static final Logger log = LoggerFactory.getLogger(RegionFetchScheduler.class);

  static final String REASON_BUDGET_DENIED = "budget_denied";
  static final String REASON_CREDENTIALS_REJECTED = "credentials_rejected";
  static final String REASON_AUTH_FAILED = "auth_failed";
  static final String REASON_RATE_LIMITED = "rate_limited";
  static final String REASON_TRANSPORT = "transport_error";
  static final String REASON_MALFORMED = "malformed_payload";
  static final String REASON_WORKER_REJECTED = "worker_rejected";
  static final String REASON_INTERNAL = "internal_error";

  private final RegionCatalog catalog;
  private final CreditBudgetTracker budget;
  private final OpenSkyClient client;
  private final OpenSkyTokenService tokenService;
  private final TransformPipeline pipeline;
  private final AnalyticsEngine analyticsEngine;
  private final SnapshotStore snapshotStore;
  private final RawResponseCache rawCache;
  private final Clock clock;
  private final Executor workers;
  private final Map<String, Slot> slots = new LinkedHashMap<>();

  private final Counter fetchSuccessCounter;
  private final Counter fetchFailedCounter;
  private final Counter fetchDeniedCounter;
  private final Counter fetchSkippedCounter;
  private final Counter fallbackCounter;
  private final Counter recordsReceivedCounter;
  private final Counter recordsDroppedCounter;
  private final Counter recordsDuplicateCounter;
  private final Timer fetchTimer;
  private final AtomicBoolean rejectionLogged = new AtomicBoolean(false);
  private final AtomicBoolean cacheRestored = new AtomicBoolean(false);

  private static final class Slot {
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicReference<RegionStatus> status;

    private Slot(String region) {
      this.status = new AtomicReference<>(RegionStatus.idle(region));
    }

    private void update(UnaryOperator<RegionStatus> change) {
      status.updateAndGet(change);
    }
  }

  @Autowired
  public RegionFetchScheduler(
      RegionCatalog catalog,
      CreditBudgetTracker budget,
      OpenSkyClient client,
      OpenSkyTokenService tokenService,
      TransformPipeline pipeline,
      AnalyticsEngine analyticsEngine,
      SnapshotStore snapshotStore,
      RawResponseCache rawCache,
      IngesterProperties ingesterProperties,
      OpenSkyProperties openSkyProperties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this(catalog, budget, client, tokenService, pipeline, analyticsEngine, snapshotStore, rawCache,
        meterRegistry, clock, workerPool(ingesterProperties, catalog));
    if (openSkyProperties.requestTimeoutMs() >= ingesterProperties.refreshMs()) {
      throw new ConfigurationException(
          "opensky.request-timeout-ms (" + openSkyProperties.requestTimeoutMs()
              + ") must be shorter than ingester.refresh-ms (" + ingesterProperties.refreshMs() + ")");
    }
    log.info("Region fetch scheduler: {} regions, refresh every {} ms, request timeout {} ms",
        catalog.size(), ingesterProperties.refreshMs(), openSkyProperties.requestTimeoutMs());
  }

  RegionFetchScheduler(
      RegionCatalog catalog,
      CreditBudgetTracker budget,
      OpenSkyClient client,
      OpenSkyTokenService tokenService,
      TransformPipeline pipeline,
      AnalyticsEngine analyticsEngine,
      SnapshotStore snapshotStore,
      RawResponseCache rawCache,
      MeterRegistry meterRegistry,
      Clock clock,
      Executor workers) {
    this.catalog = catalog;
    this.budget = budget;
    this.client = client;
    this.tokenService = tokenService;
    this.pipeline = pipeline;
    this.analyticsEngine = analyticsEngine;
    this.snapshotStore = snapshotStore;
    this.rawCache = rawCache;
    this.clock = clock;
    this.workers = workers;
    for (Region region : catalog.ordered()) {
      slots.put(region.name(), new Slot(region.name()));
    }

    this.fetchSuccessCounter = fetchCounter(meterRegistry, "success");
    this.fetchFailedCounter = fetchCounter(meterRegistry, "failed");
    this.fetchDeniedCounter = fetchCounter(meterRegistry, "budget_denied");
    this.fetchSkippedCounter = fetchCounter(meterRegistry, "skipped_in_flight");
    this.fallbackCounter = meterRegistry.counter("ingester.fetch.cache_fallback.total");
    this.recordsReceivedCounter = meterRegistry.counter("ingester.records.received.total");
    this.recordsDroppedCounter = meterRegistry.counter("ingester.records.dropped.total");
    this.recordsDuplicateCounter = meterRegistry.counter("ingester.records.duplicates.total");
    this.fetchTimer = Timer.builder("ingester.fetch.duration")
        .description("Region fetch duration including transform and analytics (seconds)")
        .register(meterRegistry);
  }

  private static Counter fetchCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("ingester.fetch.requests.total")
        .description("Region fetch attempts (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private static ExecutorService workerPool(IngesterProperties properties, RegionCatalog catalog) {
    int configured = properties.workerThreads() > 0 ? properties.workerThreads() : catalog.size();
    int size = Math.max(1, Math.min(configured, catalog.size()));
    return Executors.newFixedThreadPool(size, new CustomizableThreadFactory("region-fetch-"));
  }

  @Scheduled(
      fixedRateString = "${ingester.refresh-ms}",
      initialDelayString = "${ingester.initial-delay-ms:5000}")
  public void tick() {
    if (cacheRestored.compareAndSet(false, true)) {
      catalog.ordered().forEach(this::fallbackFromCache);
    }
    if (tokenService.credentialsRejected()) {
      if (rejectionLogged.compareAndSet(false, true)) {
        log.error("OpenSky credentials were rejected; no further fetches until restart");
      }
      for (Region region : catalog.ordered()) {
        Slot slot = slots.get(region.name());
        if (slot.inFlight.compareAndSet(false, true)) {
          slot.update(status -> status.attempting(clock.instant()).failed(REASON_CREDENTIALS_REJECTED));
          fallbackFromCache(region);
          slot.inFlight.set(false);
        }
      }
      return;
    }

    int dispatched = 0;
    int denied = 0;
    int skipped = 0;
    for (Region region : catalog.ordered()) {
      Slot slot = slots.get(region.name());
      if (!slot.inFlight.compareAndSet(false, true)) {
        fetchSkippedCounter.increment();
        skipped++;
        log.debug("Region {} still in flight, skipping this tick", region.name());
        continue;
      }
      slot.update(status -> status.attempting(clock.instant()));

      BudgetDecision decision = budget.authorize(region.estimatedCreditCost());
      if (!decision.granted()) {
        fetchDeniedCounter.increment();
        denied++;
        slot.update(status -> status.failed(REASON_BUDGET_DENIED));
        log.warn("Budget denied region {} (cost={}, consumed={}, limit={})",
            region.name(), decision.cost(), decision.consumed(), decision.limit());
        fallbackFromCache(region);
        slot.inFlight.set(false);
        continue;
      }

      slot.update(RegionStatus::fetching);
      try {
        workers.execute(() -> fetchRegion(region, slot));
        dispatched++;
      } catch (RejectedExecutionException ex) {
        fetchFailedCounter.increment();
        slot.update(status -> status.failed(REASON_WORKER_REJECTED));
        slot.inFlight.set(false);
        log.warn("Worker pool rejected fetch for region {}", region.name());
      }
    }
    log.debug("Tick: dispatched={}, denied={}, skipped={}", dispatched, denied, skipped);
  }

  private void fetchRegion(Region region, Slot slot) {
    long startNs = System.nanoTime();
    try {
      StatesResponse response = client.fetchStates(region.boundingBox());
      rawCache.put(region.name(), new CachedPayload(response.body(), response.fetchedAt()));
      Snapshot snapshot = buildSnapshot(region.name(), response.body(), response.fetchedAt());
      snapshotStore.publish(snapshot);
      fetchSuccessCounter.increment();
      slot.update(status -> status.succeeded(clock.instant(), response.remainingCredits()));
      log.info("Region {}: {} records, {} anomalies, captured_at={}",
          region.name(), snapshot.aggregates().totalCount(),
          snapshot.aggregates().anomalyCount(), snapshot.capturedAt());
    } catch (OpenSkyAuthException ex) {
      fail(region, slot, ex.isRetryable() ? REASON_AUTH_FAILED : REASON_CREDENTIALS_REJECTED, ex);
    } catch (UpstreamTransportException ex) {
      String reason = ex.isRateLimited()
          ? REASON_RATE_LIMITED
          : ex.getStatusCode() > 0 ? "upstream_status_" + ex.getStatusCode() : REASON_TRANSPORT;
      fail(region, slot, reason, ex);
    } catch (MalformedPayloadException ex) {
      fail(region, slot, REASON_MALFORMED, ex);
    } catch (RuntimeException ex) {
      // Keep the loop and the other regions running.
      log.error("Unexpected failure fetching region {}", region.name(), ex);
      fail(region, slot, REASON_INTERNAL, ex);
    } finally {
      fetchTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
      slot.inFlight.set(false);
    }
  }

  private void fail(Region region, Slot slot, String reason, RuntimeException ex) {
    fetchFailedCounter.increment();
    slot.update(status -> status.failed(reason));
    log.warn("Region {} fetch failed ({}): {}", region.name(), reason, ex.getMessage());
    fallbackFromCache(region);
  }

  private void fallbackFromCache(Region region) {
    if (snapshotStore.current(region.name()).isPresent()) {
      return;
    }
    Optional<CachedPayload> cached = rawCache.latest(region.name());
    if (cached.isEmpty()) {
      return;
    }
    try {
      Snapshot snapshot = buildSnapshot(region.name(), cached.get().body(), cached.get().fetchedAt());
      if (snapshotStore.publish(snapshot)) {
        fallbackCounter.increment();
        log.info("Region {}: published snapshot from cached payload fetched at {}",
            region.name(), cached.get().fetchedAt());
      }
    } catch (MalformedPayloadException ex) {
      log.warn("Cached payload for region {} is unreadable: {}", region.name(), ex.getMessage());
    }
  }

  private Snapshot buildSnapshot(String region, String body, Instant capturedAt) {
    TransformResult result = pipeline.transform(body);
    recordsReceivedCounter.increment(result.received());
    recordsDroppedCounter.increment(result.dropped());
    recordsDuplicateCounter.increment(result.duplicates());
    AnalyticsResult aggregates = analyticsEngine.analyze(result.records());
    return Snapshot.of(region, capturedAt, result.records(), aggregates);
  }

  /** Statuses in catalog order. */
  public List<RegionStatus> statuses() {
    List<RegionStatus> result = new ArrayList<>(slots.size());
    slots.values().forEach(slot -> result.add(slot.status.get()));
    return result;
  }

  public Optional<RegionStatus> status(String region) {
    Slot slot = slots.get(region);
    return slot == null ? Optional.empty() : Optional.of(slot.status.get());
  }

  @PreDestroy
  public void shutdown() {
    if (workers instanceof ExecutorService executor) {
      executor.shutdownNow();
      try {
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Region fetch workers did not stop within 5s");
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
