package com.skypulse.ingester.api;

import com.skypulse.analytics.model.Snapshot;
import com.skypulse.ingester.region.Region;
import com.skypulse.ingester.region.RegionCatalog;
import com.skypulse.ingester.snapshot.SnapshotListener;
import com.skypulse.ingester.snapshot.SnapshotStore;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-Sent Events broadcaster for snapshot publishes.
 *
 * <p>Emits {@code snapshot-update} for every snapshot accepted by the {@link SnapshotStore}, plus a
 * periodic {@code heartbeat} to keep idle connections open through proxies.
 */
@Service
public class SnapshotStreamService implements SnapshotListener {
  private static final Logger log = LoggerFactory.getLogger(SnapshotStreamService.class);
  private static final long STREAM_TIMEOUT_MS = 0L;
  private static final long HEARTBEAT_INTERVAL_MS = 15_000L;

  private final SnapshotStore snapshotStore;
  private final RegionCatalog catalog;
  private final Set<SseEmitter> emitters = ConcurrentHashMap.newKeySet();
  private final ScheduledExecutorService heartbeat =
      Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "snapshot-stream-heartbeat");
        thread.setDaemon(true);
        return thread;
      });

  private volatile boolean started = false;

  public SnapshotStreamService(SnapshotStore snapshotStore, RegionCatalog catalog) {
    this.snapshotStore = snapshotStore;
    this.catalog = catalog;
    snapshotStore.addListener(this);
  }

  /**
   * Opens an SSE stream. The {@code connected} event lists the capture time of every region that
   * already has a snapshot.
   */
  public SseEmitter openStream() {
    startIfNeeded();

    SseEmitter emitter = createEmitter();
    emitters.add(emitter);
    emitter.onCompletion(() -> emitters.remove(emitter));
    emitter.onTimeout(() -> emitters.remove(emitter));
    emitter.onError(ex -> emitters.remove(emitter));

    Map<String, Object> regions = new LinkedHashMap<>();
    for (Region region : catalog.ordered()) {
      regions.put(region.name(),
          snapshotStore.current(region.name()).map(s -> s.capturedAt().toString()).orElse(null));
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("regions", regions);
    payload.put("timestamp", Instant.now().toString());
    sendEvent(emitter, "connected", payload);
    return emitter;
  }

  SseEmitter createEmitter() {
    return new SseEmitter(STREAM_TIMEOUT_MS);
  }

  int connectedClients() {
    return emitters.size();
  }

  @Override
  public void onSnapshot(Snapshot snapshot) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("region", snapshot.region());
    payload.put("captured_at", snapshot.capturedAt().toString());
    payload.put("total_count", snapshot.aggregates().totalCount());
    payload.put("anomaly_count", snapshot.aggregates().anomalyCount());
    payload.put("timestamp", Instant.now().toString());
    broadcast("snapshot-update", payload);
  }

  private synchronized void startIfNeeded() {
    if (started) {
      return;
    }
    started = true;
    heartbeat.scheduleWithFixedDelay(
        this::sendHeartbeat, HEARTBEAT_INTERVAL_MS, HEARTBEAT_INTERVAL_MS, TimeUnit.MILLISECONDS);
  }

  void sendHeartbeat() {
    broadcast("heartbeat", Map.of("timestamp", Instant.now().toString()));
  }

  private void broadcast(String eventName, Map<String, Object> payload) {
    for (SseEmitter emitter : emitters) {
      sendEvent(emitter, eventName, payload);
    }
  }

  private void sendEvent(SseEmitter emitter, String eventName, Map<String, Object> payload) {
    try {
      emitter.send(SseEmitter.event().name(eventName).data(payload));
    } catch (Exception ex) {
      emitters.remove(emitter);
      if (isExpectedClientDisconnect(ex)) {
        log.debug("SSE client disconnected during {} delivery", eventName);
        emitter.complete();
        return;
      }
      log.warn("SSE event delivery failed for event={}", eventName, ex);
      emitter.completeWithError(ex);
    }
  }

  static boolean isExpectedClientDisconnect(Throwable error) {
    Throwable current = error;
    while (current != null) {
      String className = current.getClass().getName();
      if (className.endsWith("ClientAbortException") || className.endsWith("EofException")) {
        return true;
      }
      String message = current.getMessage();
      if (message != null) {
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("broken pipe") || normalized.contains("connection reset")) {
          return true;
        }
      }
      current = current.getCause();
    }
    return false;
  }

  @PreDestroy
  public void shutdown() {
    snapshotStore.removeListener(this);
    heartbeat.shutdownNow();
    emitters.forEach(SseEmitter::complete);
    emitters.clear();
  }
}
