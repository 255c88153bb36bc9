package dev.candor.scoring;

import java.util.Locale;

/**
 * Names a scoring pool: a job family and a competency. Scores are only ever compared within one
 * cohort.
 */
public record CohortKey(String family, String competencyId) {

  /** Competency id of the composite-score cohort of a family. */
  public static final String OVERALL = "overall";

  public CohortKey {
    if (family == null || family.isBlank() || competencyId == null || competencyId.isBlank()) {
      throw new IllegalArgumentException("Cohort family and competency must not be blank");
    }
    family = family.trim().toLowerCase(Locale.ROOT);
  }

  public static CohortKey overall(String family) {
    return new CohortKey(family, OVERALL);
  }

  /** {@code family/competencyId}. */
  public String asString() {
    return family + "/" + competencyId;
  }
}
