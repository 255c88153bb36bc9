package dev.candor.scoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.candor.cache.SharedStore;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns every cohort's {@link ScoringPool}. Pools are created on first use, restored from the shared
 * store when a snapshot was persisted, and persisted again after every recalibration.
 */
@Service
public class ScoringPoolRegistry {

  private static final Logger log = LoggerFactory.getLogger(ScoringPoolRegistry.class);

  static final String KEY_PREFIX = "pool:";

  private final ConcurrentMap<CohortKey, ScoringPool> pools = new ConcurrentHashMap<>();
  private final ScoringProperties properties;
  private final SharedStore sharedStore;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ScoringPoolRegistry(
      ScoringProperties properties,
      SharedStore sharedStore,
      ObjectMapper objectMapper,
      Clock clock) {
    this.properties = properties;
    this.sharedStore = sharedStore;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /** Inserts a score into the cohort's pool. */
  public RecordOutcome record(CohortKey key, double rawScore) {
    RecordOutcome outcome = pool(key).record(rawScore);
    if (outcome.recalibrated()) {
      persist(outcome.snapshot());
    }
    return outcome;
  }

  /** Percentile of a score within its cohort. */
  public PercentileResult percentile(
      CohortKey key, String answerId, double rawScore, boolean outlierExcluded) {
    return pool(key).percentile(answerId, rawScore, outlierExcluded);
  }

  /** Forces a recalibration of the cohort and persists the result. */
  public PoolSnapshot recalibrate(CohortKey key) {
    PoolSnapshot snapshot = pool(key).recalibrate();
    persist(snapshot);
    return snapshot;
  }

  public PoolSnapshot snapshot(CohortKey key) {
    return pool(key).snapshot();
  }

  private ScoringPool pool(CohortKey key) {
    ScoringPool pool = pools.get(key);
    if (pool != null) {
      return pool;
    }
    // restored outside the map so the store round-trip holds no lock shared with other cohorts
    ScoringPool restored = restoreOrCreate(key);
    ScoringPool raced = pools.putIfAbsent(key, restored);
    return raced != null ? raced : restored;
  }

  private ScoringPool restoreOrCreate(CohortKey key) {
    Optional<String> persisted;
    try {
      persisted = sharedStore.get(storeKey(key));
    } catch (RuntimeException e) {
      log.warn("Shared store unavailable restoring cohort {}: {}", key.asString(), e.getMessage());
      persisted = Optional.empty();
    }
    if (persisted.isPresent()) {
      try {
        PoolSnapshot snapshot = objectMapper.readValue(persisted.get(), PoolSnapshot.class);
        if (snapshot.histogram().bins() == properties.getBins() && key.equals(snapshot.cohort())) {
          log.info(
              "Restored cohort {} (count {}, calibration version {})",
              key.asString(),
              snapshot.count(),
              snapshot.calibrationVersion());
          return new ScoringPool(snapshot, properties, clock);
        }
        log.warn(
            "Persisted snapshot for cohort {} does not match configuration, starting fresh",
            key.asString());
      } catch (JsonProcessingException | IllegalArgumentException e) {
        log.warn(
            "Discarding unreadable snapshot for cohort {}: {}", key.asString(), e.getMessage());
      }
    }
    return new ScoringPool(key, properties, clock);
  }

  private void persist(PoolSnapshot snapshot) {
    try {
      sharedStore.set(storeKey(snapshot.cohort()), objectMapper.writeValueAsString(snapshot), null);
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn(
          "Could not persist snapshot of cohort {}: {}",
          snapshot.cohort().asString(),
          e.getMessage());
    }
  }

  static String storeKey(CohortKey key) {
    return KEY_PREFIX + key.family() + ":" + key.competencyId();
  }
}
