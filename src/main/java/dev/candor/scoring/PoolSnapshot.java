package dev.candor.scoring;

import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Immutable published state of one scoring pool. Also the persisted form.
 *
 * @param cohort the pool's cohort
 * @param count samples inserted, outliers included
 * @param mean running mean of every sample (Welford)
 * @param m2 running sum of squared deviations (Welford)
 * @param histogram distribution of every sample
 * @param baselineMean decayed mean of the calibration window, null before the first calibration
 * @param baselineStdDev decayed standard deviation of the calibration window
 * @param calibrationVersion incremented by every recalibration
 * @param lastRecalibratedAt time of the last recalibration
 * @param insertionsSinceCalibration insertions since the last recalibration
 * @param window recent non-outlier samples, oldest first
 */
public record PoolSnapshot(
    CohortKey cohort,
    long count,
    double mean,
    double m2,
    QuantileHistogram histogram,
    @Nullable Double baselineMean,
    @Nullable Double baselineStdDev,
    long calibrationVersion,
    @Nullable Instant lastRecalibratedAt,
    int insertionsSinceCalibration,
    List<Double> window) {

  public PoolSnapshot {
    window = List.copyOf(window);
  }

  public static PoolSnapshot empty(CohortKey cohort, int bins) {
    return new PoolSnapshot(
        cohort, 0, 0.0, 0.0, QuantileHistogram.empty(bins), null, null, 0, null, 0, List.of());
  }

  public boolean hasBaseline() {
    return baselineMean != null && baselineStdDev != null;
  }

  /** Population variance of every sample. */
  public double variance() {
    return count < 2 ? 0.0 : m2 / count;
  }
}
