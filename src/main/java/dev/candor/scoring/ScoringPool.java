package dev.candor.scoring;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streaming score distribution of one cohort.
 *
 * <p>Writers are serialized by a lock; every write publishes a new immutable {@link PoolSnapshot}
 * that readers use without locking. Statistics change only by insertion or by recalibration, and
 * every recalibration increments the calibration version and is logged.
 */
public class ScoringPool {

  private static final Logger log = LoggerFactory.getLogger(ScoringPool.class);

  private final CohortKey cohort;
  private final ScoringProperties properties;
  private final Clock clock;
  private final ReentrantLock writeLock = new ReentrantLock();

  private final Deque<Double> window = new ArrayDeque<>();
  private long count;
  private double mean;
  private double m2;
  private QuantileHistogram histogram;
  private @Nullable Double baselineMean;
  private @Nullable Double baselineStdDev;
  private long calibrationVersion;
  private @Nullable Instant lastRecalibratedAt;
  private int insertionsSinceCalibration;
  private Instant calibrationReference;

  private volatile PoolSnapshot snapshot;

  public ScoringPool(CohortKey cohort, ScoringProperties properties, Clock clock) {
    this(PoolSnapshot.empty(cohort, properties.getBins()), properties, clock);
  }

  /** Restores a pool from a persisted snapshot. */
  public ScoringPool(PoolSnapshot restored, ScoringProperties properties, Clock clock) {
    this.cohort = restored.cohort();
    this.properties = properties;
    this.clock = clock;
    this.count = restored.count();
    this.mean = restored.mean();
    this.m2 = restored.m2();
    this.histogram = restored.histogram();
    this.baselineMean = restored.baselineMean();
    this.baselineStdDev = restored.baselineStdDev();
    this.calibrationVersion = restored.calibrationVersion();
    this.lastRecalibratedAt = restored.lastRecalibratedAt();
    this.insertionsSinceCalibration = restored.insertionsSinceCalibration();
    this.calibrationReference =
        restored.lastRecalibratedAt() != null ? restored.lastRecalibratedAt() : clock.instant();
    List<Double> samples = restored.window();
    int from = Math.max(0, samples.size() - properties.getWindowSize());
    window.addAll(samples.subList(from, samples.size()));
    this.snapshot = buildSnapshot();
  }

  public CohortKey cohort() {
    return cohort;
  }

  public PoolSnapshot snapshot() {
    return snapshot;
  }

  /**
   * Inserts a score, flagging it as an outlier when a baseline exists and the score lies more than
   * {@code k} baseline standard deviations from the baseline mean. Outliers enter the histogram but
   * not the calibration window.
   *
   * @throws IllegalArgumentException if the score is outside [0, 1]
   */
  public RecordOutcome record(double rawScore) {
    if (!(rawScore >= 0.0 && rawScore <= 1.0)) {
      throw new IllegalArgumentException("Score must be in [0, 1], got: " + rawScore);
    }
    writeLock.lock();
    try {
      boolean outlier = isOutlier(rawScore);
      count++;
      double delta = rawScore - mean;
      mean += delta / count;
      m2 += delta * (rawScore - mean);
      histogram = histogram.withSample(rawScore);
      if (!outlier) {
        window.addLast(rawScore);
        while (window.size() > properties.getWindowSize()) {
          window.removeFirst();
        }
      } else {
        log.debug("Score {} flagged as outlier in cohort {}", rawScore, cohort.asString());
      }
      insertionsSinceCalibration++;

      boolean recalibrated = false;
      if (recalibrationDue()) {
        recalibrateLocked("scheduled");
        recalibrated = true;
      }
      snapshot = buildSnapshot();
      return new RecordOutcome(snapshot, outlier, recalibrated);
    } finally {
      writeLock.unlock();
    }
  }

  /** Recalibrates now. A pool with an empty window is left unchanged. */
  public PoolSnapshot recalibrate() {
    writeLock.lock();
    try {
      if (!window.isEmpty()) {
        recalibrateLocked("explicit");
        snapshot = buildSnapshot();
      }
      return snapshot;
    } finally {
      writeLock.unlock();
    }
  }

  /** Percentile of a score against the last published snapshot. */
  public PercentileResult percentile(String answerId, double rawScore, boolean outlierExcluded) {
    PoolSnapshot current = snapshot;
    return new PercentileResult(
        answerId,
        cohort.competencyId(),
        current.histogram().percentile(rawScore),
        current.count(),
        outlierExcluded,
        current.count() < properties.getMinPoolSize());
  }

  private boolean isOutlier(double rawScore) {
    if (properties.getOutlierK() <= 0.0 || baselineMean == null || baselineStdDev == null) {
      return false;
    }
    double spread = Math.max(baselineStdDev, properties.getMinStdDev());
    return Math.abs(rawScore - baselineMean) > properties.getOutlierK() * spread;
  }

  private boolean recalibrationDue() {
    if (window.isEmpty()) {
      return false;
    }
    if (baselineMean == null) {
      return window.size() >= properties.getOutlierMinSamples();
    }
    if (insertionsSinceCalibration >= properties.getRecalibrationInterval()) {
      return true;
    }
    Duration elapsed = Duration.between(calibrationReference, clock.instant());
    return elapsed.compareTo(properties.getRecalibrationPeriod()) >= 0;
  }

  private void recalibrateLocked(String reason) {
    List<Double> samples = new ArrayList<>(window);
    int n = samples.size();
    double weightSum = 0.0;
    double weightedSum = 0.0;
    double weight = 1.0;
    // newest sample carries weight 1, each older one decay times the next
    for (int i = n - 1; i >= 0; i--) {
      weightSum += weight;
      weightedSum += weight * samples.get(i);
      weight *= properties.getDecay();
    }
    double newMean = weightedSum / weightSum;
    double weightedSquares = 0.0;
    weight = 1.0;
    for (int i = n - 1; i >= 0; i--) {
      double deviation = samples.get(i) - newMean;
      weightedSquares += weight * deviation * deviation;
      weight *= properties.getDecay();
    }
    double newStdDev = Math.sqrt(weightedSquares / weightSum);

    Double previousMean = baselineMean;
    baselineMean = newMean;
    baselineStdDev = newStdDev;
    calibrationVersion++;
    lastRecalibratedAt = clock.instant();
    calibrationReference = lastRecalibratedAt;
    insertionsSinceCalibration = 0;
    log.info(
        "Recalibrated cohort {} ({}): version {}, baseline mean {} -> {}, std dev {}, window {}",
        cohort.asString(),
        reason,
        calibrationVersion,
        previousMean == null ? "none" : String.format("%.4f", previousMean),
        String.format("%.4f", newMean),
        String.format("%.4f", newStdDev),
        n);
  }

  private PoolSnapshot buildSnapshot() {
    return new PoolSnapshot(
        cohort,
        count,
        mean,
        m2,
        histogram,
        baselineMean,
        baselineStdDev,
        calibrationVersion,
        lastRecalibratedAt,
        insertionsSinceCalibration,
        new ArrayList<>(window));
  }
}
