package dev.candor.cache;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Response cache settings, bound from {@code candor.cache.*}.
 *
 * <ul>
 *   <li>{@code capacity} - maximum in-process entries (default 10000)
 *   <li>{@code default-ttl} - freshness window for generated artifacts (default 24h)
 *   <li>{@code sweep-interval-ms} - delay between expiry sweeps (default 5 minutes)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "candor.cache")
public class CacheProperties {

  private long capacity = 10_000;
  private Duration defaultTtl = Duration.ofHours(24);
  private long sweepIntervalMs = 300_000;

  @PostConstruct
  void validate() {
    if (capacity < 1) {
      throw new IllegalStateException("candor.cache.capacity must be >= 1, got: " + capacity);
    }
    if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
      throw new IllegalStateException(
          "candor.cache.default-ttl must be positive, got: " + defaultTtl);
    }
    if (sweepIntervalMs < 1) {
      throw new IllegalStateException(
          "candor.cache.sweep-interval-ms must be >= 1, got: " + sweepIntervalMs);
    }
  }

  public long getCapacity() {
    return capacity;
  }

  public void setCapacity(long capacity) {
    this.capacity = capacity;
  }

  public Duration getDefaultTtl() {
    return defaultTtl;
  }

  public void setDefaultTtl(Duration defaultTtl) {
    this.defaultTtl = defaultTtl;
  }

  public long getSweepIntervalMs() {
    return sweepIntervalMs;
  }

  public void setSweepIntervalMs(long sweepIntervalMs) {
    this.sweepIntervalMs = sweepIntervalMs;
  }
}
