package dev.candor.cache;

import java.time.Duration;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Key-value store shared by every process of the engine. Backs the second cache tier and persisted
 * scoring-pool snapshots. Values are opaque strings (JSON in practice).
 */
public interface SharedStore {

  /** The value, unless absent or expired. */
  Optional<String> get(String key);

  /** Writes the value; a null ttl means it never expires. */
  void set(String key, String value, @Nullable Duration ttl);

  /**
   * Resets the expiry of an existing key to {@code now + ttl}.
   *
   * @return false if the key does not exist
   */
  boolean expire(String key, Duration ttl);

  /**
   * Removes every expired entry.
   *
   * @return number of entries removed
   */
  int purgeExpired();
}
