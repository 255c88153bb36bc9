package dev.candor.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached payload and its age bookkeeping.
 *
 * @param fingerprint cache key
 * @param payload the cached value
 * @param createdAt when the value was computed
 * @param ttl how long the value stays fresh
 */
public record CacheEntry(String fingerprint, Object payload, Instant createdAt, Duration ttl) {

  public boolean isFresh(Instant now) {
    return Duration.between(createdAt, now).compareTo(ttl) < 0;
  }
}
