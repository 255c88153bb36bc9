package dev.candor.question;

/**
 * Some framework competencies are still uncovered after corrective generation. Carries the partial,
 * flagged set so the caller can decide to proceed or abort.
 */
public class CoverageException extends RuntimeException {

  private final QuestionSet partialSet;

  public CoverageException(QuestionSet partialSet) {
    super(
        "No question covers competencies "
            + partialSet.uncoveredCompetencyIds()
            + " of framework "
            + partialSet.frameworkId());
    this.partialSet = partialSet;
  }

  public QuestionSet partialSet() {
    return partialSet;
  }
}
