package dev.candor.evaluation;

import java.util.List;

/**
 * Score of one answer on one competency.
 *
 * @param answerId scored answer
 * @param competencyId scored competency
 * @param rubricVersion version of the rubric applied; always that of the answered question
 * @param rawScore score in [0, 1]
 * @param confidence evaluator confidence in [0, 1]
 * @param justification evaluator reasoning
 * @param contributingSpans answer excerpts behind the score
 */
public record DimensionScore(
    String answerId,
    String competencyId,
    String rubricVersion,
    double rawScore,
    double confidence,
    String justification,
    List<ContributingSpan> contributingSpans) {

  public DimensionScore {
    if (!(rawScore >= 0.0 && rawScore <= 1.0)) {
      throw new IllegalArgumentException("rawScore must be in [0, 1], got: " + rawScore);
    }
    if (!(confidence >= 0.0 && confidence <= 1.0)) {
      throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
    }
    justification = justification == null ? "" : justification;
    contributingSpans = contributingSpans == null ? List.of() : List.copyOf(contributingSpans);
  }

  /** The same score attributed to another answer with identical content. */
  public DimensionScore forAnswer(String otherAnswerId) {
    if (otherAnswerId.equals(answerId)) {
      return this;
    }
    return new DimensionScore(
        otherAnswerId,
        competencyId,
        rubricVersion,
        rawScore,
        confidence,
        justification,
        contributingSpans);
  }
}
