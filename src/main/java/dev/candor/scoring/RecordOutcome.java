package dev.candor.scoring;

/**
 * Result of inserting one score.
 *
 * @param snapshot pool state after the insertion
 * @param outlier whether the score was excluded from the calibration window
 * @param recalibrated whether the insertion triggered a recalibration
 */
public record RecordOutcome(PoolSnapshot snapshot, boolean outlier, boolean recalibrated) {}
