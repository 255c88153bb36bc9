package dev.candor.framework;

import java.util.List;

/** The model could not produce a framework with both technical and non-technical competencies. */
public class FrameworkValidationException extends RuntimeException {

  private final List<Competency> rejectedCompetencies;

  public FrameworkValidationException(String message, List<Competency> rejectedCompetencies) {
    super(message);
    this.rejectedCompetencies = List.copyOf(rejectedCompetencies);
  }

  public List<Competency> rejectedCompetencies() {
    return rejectedCompetencies;
  }
}
