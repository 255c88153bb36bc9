package dev.candor.framework;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Weighted competencies a role is evaluated on. Weights sum to 1.
 *
 * @param jobContextId the job this framework was generated for
 * @param competencies competencies in generation order
 * @param promptVersion qualified version of the template that produced it
 * @param createdAt generation time
 */
public record CompetencyFramework(
    String jobContextId, List<Competency> competencies, String promptVersion, Instant createdAt) {

  static final double WEIGHT_TOLERANCE = 1e-6;

  public CompetencyFramework {
    competencies = List.copyOf(competencies);
    if (competencies.isEmpty()) {
      throw new IllegalArgumentException("A framework needs at least one competency");
    }
    double sum = competencies.stream().mapToDouble(Competency::weight).sum();
    if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
      throw new IllegalArgumentException("Competency weights must sum to 1, got: " + sum);
    }
  }

  /** {@code jobContextId@promptVersion}. */
  public String id() {
    return jobContextId + "@" + promptVersion;
  }

  public Optional<Competency> competency(String competencyId) {
    return competencies.stream().filter(c -> c.id().equals(competencyId)).findFirst();
  }
}
