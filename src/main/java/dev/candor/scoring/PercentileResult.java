package dev.candor.scoring;

/**
 * Percentile of one score within its cohort.
 *
 * @param answerId scored answer
 * @param competencyId cohort competency, {@link CohortKey#OVERALL} for composites
 * @param percentile percentile in [0, 100]
 * @param poolSizeAtComputation pool size when computed
 * @param outlierExcluded whether the score was flagged as an outlier on insertion
 * @param provisional true when the pool was smaller than the minimum pool size
 */
public record PercentileResult(
    String answerId,
    String competencyId,
    double percentile,
    long poolSizeAtComputation,
    boolean outlierExcluded,
    boolean provisional) {}
