package dev.candor.explain;

import java.util.List;

/**
 * One dimension's share of the composite score.
 *
 * @param competencyId the competency
 * @param contribution effective weight times raw score
 * @param rawScore dimension score
 * @param confidence evaluator confidence
 * @param justification evaluator reasoning
 * @param positiveSpans answer excerpts that raised the score
 * @param negativeSpans answer excerpts that lowered it
 */
public record DimensionHighlight(
    String competencyId,
    double contribution,
    double rawScore,
    double confidence,
    String justification,
    List<String> positiveSpans,
    List<String> negativeSpans) {

  public DimensionHighlight {
    positiveSpans = List.copyOf(positiveSpans);
    negativeSpans = List.copyOf(negativeSpans);
  }
}
