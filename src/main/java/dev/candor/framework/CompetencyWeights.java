package dev.candor.framework;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Weight normalization for generated frameworks. */
public final class CompetencyWeights {

  private CompetencyWeights() {}

  /**
   * Normalizes raw weights so they sum to 1.
   *
   * <p>Negative weights clamp to 0. If any weight is missing, or the clamped weights do not sum to
   * positive value, every competency gets the same weight.
   *
   * @param raw raw weights, null meaning "not given"
   * @return normalized weights in the same order
   */
  public static List<Double> normalize(List<@Nullable Double> raw) {
    if (raw.isEmpty()) {
      return List.of();
    }
    boolean anyMissing = raw.stream().anyMatch(w -> w == null || w.isNaN() || w.isInfinite());
    List<Double> clamped = new ArrayList<>(raw.size());
    double sum = 0.0;
    if (!anyMissing) {
      for (Double weight : raw) {
        double value = Math.max(0.0, weight);
        clamped.add(value);
        sum += value;
      }
    }
    List<Double> normalized = new ArrayList<>(raw.size());
    if (anyMissing || sum <= 0.0) {
      double uniform = 1.0 / raw.size();
      for (int i = 0; i < raw.size(); i++) {
        normalized.add(uniform);
      }
      return normalized;
    }
    for (double value : clamped) {
      normalized.add(value / sum);
    }
    return normalized;
  }
}
