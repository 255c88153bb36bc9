package dev.candor.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically evicts expired response-cache entries from both tiers. */
@Component
public class CacheSweeper {

  private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

  private final ResponseCache responseCache;

  public CacheSweeper(ResponseCache responseCache) {
    this.responseCache = responseCache;
  }

  @Scheduled(
      fixedDelayString = "${candor.cache.sweep-interval-ms:300000}",
      initialDelayString = "${candor.cache.sweep-interval-ms:300000}")
  public void sweep() {
    int removed = responseCache.sweep();
    if (removed > 0) {
      log.info("Evicted {} expired response-cache entries", removed);
    }
  }
}
