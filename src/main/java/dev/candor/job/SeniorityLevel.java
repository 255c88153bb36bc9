package dev.candor.job;

import java.util.Locale;

/** Seniority of the role; each level carries the expectation bar evaluators apply. */
public enum SeniorityLevel {
  JUNIOR(
      "Expect correct fundamentals and a willingness to learn; gaps in depth are acceptable if the"
          + " reasoning is sound."),
  MID(
      "Expect independent delivery of well-scoped work, sound trade-off reasoning and concrete"
          + " examples from their own experience."),
  SENIOR(
      "Expect ownership of ambiguous problems, depth across the stack, explicit trade-offs and"
          + " evidence of raising the level of the people around them."),
  LEAD(
      "Expect organisation-level impact: setting technical direction, growing other engineers and"
          + " aligning work with business outcomes.");

  private final String expectationBar;

  SeniorityLevel(String expectationBar) {
    this.expectationBar = expectationBar;
  }

  public String expectationBar() {
    return expectationBar;
  }

  /**
   * Lenient parse; accepts any case and common aliases such as {@code staff} or {@code principal}.
   *
   * @throws IllegalArgumentException for unrecognized values
   */
  public static SeniorityLevel parse(String value) {
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "JUNIOR", "ENTRY", "GRADUATE" -> JUNIOR;
      case "MID", "MIDDLE", "INTERMEDIATE" -> MID;
      case "SENIOR" -> SENIOR;
      case "LEAD", "STAFF", "PRINCIPAL" -> LEAD;
      default -> throw new IllegalArgumentException("Unknown seniority level: " + value);
    };
  }
}
