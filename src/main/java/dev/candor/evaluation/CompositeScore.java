package dev.candor.evaluation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted aggregate of the dimension scores of one answer.
 *
 * @param answerId scored answer
 * @param questionId answered question
 * @param raw composite score in [0, 1]
 * @param effectiveWeights weights actually applied per successful competency; sum to 1
 * @param dimensions successful dimension scores
 * @param failedCompetencyIds competencies whose evaluation failed or missed the deadline
 * @param partial true iff any dimension failed
 */
public record CompositeScore(
    String answerId,
    String questionId,
    double raw,
    Map<String, Double> effectiveWeights,
    List<DimensionScore> dimensions,
    List<String> failedCompetencyIds,
    boolean partial) {

  public CompositeScore {
    effectiveWeights = Map.copyOf(effectiveWeights);
    dimensions = List.copyOf(dimensions);
    failedCompetencyIds = List.copyOf(failedCompetencyIds);
  }

  /**
   * Aggregates successful dimensions, redistributing the weight of failed ones proportionally. If
   * the successful dimensions carry no weight at all they share it equally.
   *
   * @param frameworkWeights framework weight per targeted competency
   * @param successes successful dimension scores, at least one
   * @param failed competencies that produced no score
   */
  public static CompositeScore aggregate(
      String answerId,
      String questionId,
      Map<String, Double> frameworkWeights,
      List<DimensionScore> successes,
      List<String> failed) {
    if (successes.isEmpty()) {
      throw new IllegalArgumentException("At least one successful dimension is required");
    }
    double total = 0.0;
    for (DimensionScore score : successes) {
      total += Math.max(0.0, frameworkWeights.getOrDefault(score.competencyId(), 0.0));
    }
    Map<String, Double> weights = new LinkedHashMap<>();
    double raw = 0.0;
    for (DimensionScore score : successes) {
      double weight =
          total > 0.0
              ? Math.max(0.0, frameworkWeights.getOrDefault(score.competencyId(), 0.0)) / total
              : 1.0 / successes.size();
      weights.put(score.competencyId(), weight);
      raw += weight * score.rawScore();
    }
    raw = Math.min(1.0, Math.max(0.0, raw));
    return new CompositeScore(
        answerId,
        questionId,
        raw,
        weights,
        new ArrayList<>(successes),
        new ArrayList<>(failed),
        !failed.isEmpty());
  }

  /** {@code effectiveWeight * rawScore} of one dimension. */
  public double contribution(DimensionScore dimension) {
    return effectiveWeights.getOrDefault(dimension.competencyId(), 0.0) * dimension.rawScore();
  }
}
