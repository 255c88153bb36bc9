package dev.candor.prompt;

/**
 * Identifies the subject a template variant is assigned to, such as a job or a candidate. The same
 * subject always receives the same variant within one experiment.
 */
public record VariantSelector(String subjectId) {

  public VariantSelector {
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("subjectId must not be blank");
    }
  }

  public static VariantSelector of(String subjectId) {
    return new VariantSelector(subjectId);
  }
}
