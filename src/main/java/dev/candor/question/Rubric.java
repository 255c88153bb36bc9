package dev.candor.question;

import dev.candor.cache.Fingerprints;
import java.util.List;

/**
 * How answers to a question are scored.
 *
 * @param version fingerprint of the producing template version and the rubric content; every
 *     {@code DimensionScore} carries it
 * @param expectedAnswerComponents points a strong answer covers
 * @param scoringAnchors band descriptions from weak to strong
 */
public record Rubric(
    String version, List<String> expectedAnswerComponents, List<ScoringAnchor> scoringAnchors) {

  public Rubric {
    expectedAnswerComponents =
        expectedAnswerComponents == null ? List.of() : List.copyOf(expectedAnswerComponents);
    scoringAnchors = scoringAnchors == null ? List.of() : List.copyOf(scoringAnchors);
    if (version == null || version.isBlank()) {
      throw new IllegalArgumentException("Rubric version must not be blank");
    }
  }

  public static Rubric of(
      String templateVersion, List<String> components, List<ScoringAnchor> anchors) {
    StringBuilder content = new StringBuilder();
    components.forEach(c -> content.append(c).append('\n'));
    anchors.forEach(a -> content.append(a.band()).append(':').append(a.description()).append('\n'));
    String version = "r-" + Fingerprints.of(templateVersion, content.toString()).substring(0, 16);
    return new Rubric(version, components, anchors);
  }

  /** Markdown rendering used in evaluator prompts. */
  public String render() {
    StringBuilder out = new StringBuilder("Expected answer components:\n");
    if (expectedAnswerComponents.isEmpty()) {
      out.append("- (none given)\n");
    }
    expectedAnswerComponents.forEach(c -> out.append("- ").append(c).append('\n'));
    out.append("Scoring anchors:\n");
    if (scoringAnchors.isEmpty()) {
      out.append("- (none given)\n");
    }
    scoringAnchors.forEach(
        a -> out.append("- ").append(a.band()).append(": ").append(a.description()).append('\n'));
    return out.toString().strip();
  }
}
