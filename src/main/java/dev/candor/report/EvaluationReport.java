package dev.candor.report;

import dev.candor.evaluation.Answer;
import dev.candor.evaluation.CompositeScore;
import dev.candor.explain.ExplanationArtifact;
import dev.candor.scoring.PercentileResult;
import java.time.Instant;
import java.util.List;

/**
 * Everything produced for one answer.
 *
 * @param answer the evaluated answer
 * @param composite weighted composite score
 * @param percentiles one per scored dimension plus the {@code overall} composite cohort
 * @param explanation narrative, highlights and confidence
 * @param provisional true when any percentile is provisional
 * @param completedAt completion time
 */
public record EvaluationReport(
    Answer answer,
    CompositeScore composite,
    List<PercentileResult> percentiles,
    ExplanationArtifact explanation,
    boolean provisional,
    Instant completedAt) {

  public EvaluationReport {
    percentiles = List.copyOf(percentiles);
  }
}
