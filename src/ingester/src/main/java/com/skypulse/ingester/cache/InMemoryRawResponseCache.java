package com.skypulse.ingester.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local cache; expiry is checked on read against the injected clock. */
public class InMemoryRawResponseCache implements RawResponseCache {
  private final Map<String, CachedPayload> entries = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  public InMemoryRawResponseCache(Duration ttl, Clock clock) {
    this.ttl = ttl;
    this.clock = clock;
  }

  @Override
  public void put(String region, CachedPayload payload) {
    entries.merge(region, payload,
        (current, candidate) -> candidate.fetchedAt().isBefore(current.fetchedAt()) ? current : candidate);
  }

  @Override
  public Optional<CachedPayload> latest(String region) {
    CachedPayload payload = entries.get(region);
    if (payload == null) {
      return Optional.empty();
    }
    if (!clock.instant().isBefore(payload.fetchedAt().plus(ttl))) {
      entries.remove(region, payload);
      return Optional.empty();
    }
    return Optional.of(payload);
  }
}
