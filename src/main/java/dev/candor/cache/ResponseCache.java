package dev.candor.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Two-tier, fingerprint-keyed cache for generated artifacts.
 *
 * <p>Tier 1 is an in-process Caffeine cache bounded by {@code candor.cache.capacity}; tier 2 is the
 * {@link SharedStore}, holding a JSON envelope {@code {createdAt, ttlMillis, payload}}. Age is
 * checked on every read and stale entries are dropped lazily. Concurrent callers for the same
 * fingerprint share one computation; a failed computation is not cached and every waiter sees its
 * error. A computation cancelled with its caller is not an error, so waiters compute again.
 * Shared-store failures degrade to tier 1 only.
 */
@Service
public class ResponseCache {

  private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

  static final String KEY_PREFIX = "cache:";

  /** Completes an in-flight future whose owner was cancelled; waiters compute for themselves. */
  private static final Object ABANDONED = new Object();

  private final Cache<String, CacheEntry> local;
  private final ConcurrentMap<String, CompletableFuture<Object>> inFlight =
      new ConcurrentHashMap<>();
  private final SharedStore sharedStore;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final CacheProperties properties;

  public ResponseCache(
      CacheProperties properties, SharedStore sharedStore, ObjectMapper objectMapper, Clock clock) {
    this.properties = properties;
    this.sharedStore = sharedStore;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.local =
        Caffeine.newBuilder().maximumSize(properties.getCapacity()).executor(Runnable::run).build();
  }

  /** {@link #getOrCompute(String, Duration, Class, Supplier)} with the configured default ttl. */
  public <T> T getOrCompute(String fingerprint, Class<T> type, Supplier<T> compute) {
    return getOrCompute(fingerprint, properties.getDefaultTtl(), type, compute);
  }

  /**
   * Returns the fresh cached value for the fingerprint, computing and storing it if absent.
   *
   * @param fingerprint cache key, see {@link Fingerprints}
   * @param ttl freshness window for a newly computed value
   * @param type payload type, used to decode tier-2 JSON
   * @param compute producer invoked at most once per fingerprint at a time
   * @throws CancellationException if the caller is interrupted while waiting on another computation
   */
  public <T> T getOrCompute(String fingerprint, Duration ttl, Class<T> type, Supplier<T> compute) {
    T cached = fromLocal(fingerprint, type);
    if (cached != null) {
      log.debug("Cache hit (local) for {}", fingerprint);
      return cached;
    }

    CompletableFuture<Object> mine = new CompletableFuture<>();
    CompletableFuture<Object> existing = inFlight.putIfAbsent(fingerprint, mine);
    if (existing != null) {
      log.debug("Waiting on in-flight computation for {}", fingerprint);
      Object result = await(existing);
      if (result == ABANDONED) {
        inFlight.remove(fingerprint, existing);
        log.debug("In-flight computation for {} was cancelled, computing again", fingerprint);
        return getOrCompute(fingerprint, ttl, type, compute);
      }
      return type.cast(result);
    }

    try {
      T value = fromLocal(fingerprint, type);
      if (value == null) {
        value = fromShared(fingerprint, type);
      }
      if (value == null) {
        value = compute.get();
        if (value == null) {
          throw new IllegalStateException("Computation for " + fingerprint + " returned null");
        }
        Instant now = clock.instant();
        local.put(fingerprint, new CacheEntry(fingerprint, value, now, ttl));
        writeShared(fingerprint, value, now, ttl);
      }
      mine.complete(value);
      return value;
    } catch (RuntimeException | Error e) {
      if (e instanceof CancellationException || Thread.currentThread().isInterrupted()) {
        mine.complete(ABANDONED);
      } else {
        mine.completeExceptionally(e);
      }
      throw e;
    } finally {
      inFlight.remove(fingerprint, mine);
    }
  }

  /** Drops the fingerprint from both tiers. */
  public void invalidate(String fingerprint) {
    local.invalidate(fingerprint);
    try {
      sharedStore.expire(KEY_PREFIX + fingerprint, Duration.ZERO);
    } catch (RuntimeException e) {
      log.warn("Shared store unavailable while invalidating {}: {}", fingerprint, e.getMessage());
    }
  }

  /** Approximate number of in-process entries. */
  public long size() {
    local.cleanUp();
    return local.estimatedSize();
  }

  /**
   * Removes expired in-process entries and purges expired shared entries.
   *
   * @return number of in-process entries removed
   */
  public int sweep() {
    Instant now = clock.instant();
    int before = local.asMap().size();
    local.asMap().values().removeIf(entry -> !entry.isFresh(now));
    int removed = before - local.asMap().size();
    try {
      int purged = sharedStore.purgeExpired();
      log.debug("Cache sweep removed {} local and {} shared entries", removed, purged);
    } catch (RuntimeException e) {
      log.warn("Shared store purge failed: {}", e.getMessage());
    }
    return Math.max(removed, 0);
  }

  private <T> @Nullable T fromLocal(String fingerprint, Class<T> type) {
    CacheEntry entry = local.getIfPresent(fingerprint);
    if (entry == null) {
      return null;
    }
    if (!entry.isFresh(clock.instant())) {
      local.asMap().remove(fingerprint, entry);
      return null;
    }
    return type.cast(entry.payload());
  }

  private <T> @Nullable T fromShared(String fingerprint, Class<T> type) {
    Optional<String> raw;
    try {
      raw = sharedStore.get(KEY_PREFIX + fingerprint);
    } catch (RuntimeException e) {
      log.warn("Shared store unavailable reading {}: {}", fingerprint, e.getMessage());
      return null;
    }
    if (raw.isEmpty()) {
      return null;
    }
    try {
      JsonNode envelope = objectMapper.readTree(raw.get());
      Instant createdAt = Instant.ofEpochMilli(envelope.path("createdAt").asLong());
      Duration ttl = Duration.ofMillis(envelope.path("ttlMillis").asLong());
      CacheEntry entry =
          new CacheEntry(
              fingerprint,
              objectMapper.treeToValue(envelope.path("payload"), type),
              createdAt,
              ttl);
      if (!entry.isFresh(clock.instant())) {
        return null;
      }
      local.put(fingerprint, entry);
      log.debug("Cache hit (shared) for {}", fingerprint);
      return type.cast(entry.payload());
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.warn("Discarding undecodable shared entry {}: {}", fingerprint, e.getMessage());
      return null;
    }
  }

  private void writeShared(String fingerprint, Object value, Instant createdAt, Duration ttl) {
    try {
      ObjectNode envelope = objectMapper.createObjectNode();
      envelope.put("createdAt", createdAt.toEpochMilli());
      envelope.put("ttlMillis", ttl.toMillis());
      envelope.set("payload", objectMapper.valueToTree(value));
      sharedStore.set(KEY_PREFIX + fingerprint, objectMapper.writeValueAsString(envelope), ttl);
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn("Could not write {} to shared store: {}", fingerprint, e.getMessage());
    }
  }

  private static Object await(CompletableFuture<Object> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting on a cached computation");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException(cause);
    }
  }
}
