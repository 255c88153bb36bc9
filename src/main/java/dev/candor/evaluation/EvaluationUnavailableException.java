package dev.candor.evaluation;

import java.util.Map;

/** No dimension of an answer could be evaluated. */
public class EvaluationUnavailableException extends RuntimeException {

  private final String answerId;
  private final Map<String, String> failures;

  public EvaluationUnavailableException(String answerId, Map<String, String> failures) {
    super("No dimension of answer " + answerId + " could be evaluated: " + failures);
    this.answerId = answerId;
    this.failures = Map.copyOf(failures);
  }

  public String answerId() {
    return answerId;
  }

  /** Failure reason per competency id. */
  public Map<String, String> failures() {
    return failures;
  }
}
