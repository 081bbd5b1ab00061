package com.skypulse.ingester.snapshot;

import com.skypulse.analytics.model.Snapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Latest snapshot per region.
 *
 * <p>Publishing is an atomic per-region replace. Readers never block and always see a complete
 * snapshot. Once a region has a snapshot it keeps serving it until a newer one is accepted.
 */
@Component
public class SnapshotStore {
  private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

  private final Map<String, Snapshot> current = new ConcurrentHashMap<>();
  private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();
  private final Counter publishedCounter;

  public SnapshotStore(MeterRegistry meterRegistry) {
    this.publishedCounter = Counter.builder("ingester.snapshots.published.total")
        .description("Snapshots accepted by the store")
        .register(meterRegistry);
  }

  /**
   * Replaces the region's snapshot.
   *
   * @return {@code false} if the same instance is already current or {@code snapshot} is older
   *     than the current one
   */
  public boolean publish(Snapshot snapshot) {
    AtomicBoolean accepted = new AtomicBoolean(false);
    current.compute(snapshot.region(), (region, existing) -> {
      if (existing == snapshot) {
        return existing;
      }
      if (existing != null && snapshot.capturedAt().isBefore(existing.capturedAt())) {
        log.debug("Ignoring out-of-date snapshot for {}: {} < {}",
            region, snapshot.capturedAt(), existing.capturedAt());
        return existing;
      }
      accepted.set(true);
      return snapshot;
    });
    if (!accepted.get()) {
      return false;
    }
    publishedCounter.increment();
    for (SnapshotListener listener : listeners) {
      try {
        listener.onSnapshot(snapshot);
      } catch (RuntimeException ex) {
        log.warn("Snapshot listener failed for region {}", snapshot.region(), ex);
      }
    }
    return true;
  }

  public Optional<Snapshot> current(String region) {
    return Optional.ofNullable(current.get(region));
  }

  public void addListener(SnapshotListener listener) {
    listeners.add(listener);
  }

  public void removeListener(SnapshotListener listener) {
    listeners.remove(listener);
  }
}
