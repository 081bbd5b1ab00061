package com.skypulse.ingester.cache;

import java.util.Optional;

/**
 * Short-lived store of the newest raw response per region.
 *
 * <p>Entries expire after the configured TTL. Implementations never throw on backend failures; a
 * missing cache only removes the fallback path.
 */
public interface RawResponseCache {
  void put(String region, CachedPayload payload);

  /** Newest unexpired payload for the region, if any. */
  Optional<CachedPayload> latest(String region);
}
