package dev.candor.question;

import dev.candor.cache.Fingerprints;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * An interview question with its rubric.
 *
 * @param id {@code q-} plus a hash of the normalized text, scoped to the owning job by the
 *     generator
 * @param competencyIds competencies the question probes, never empty
 * @param text question text
 * @param rubric scoring rubric
 * @param followUpQuestions optional follow-ups, kept as generated
 */
public record Question(
    String id,
    List<String> competencyIds,
    String text,
    Rubric rubric,
    List<String> followUpQuestions) {

  public Question {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Question text must not be blank");
    }
    competencyIds = List.copyOf(new LinkedHashSet<>(competencyIds));
    if (competencyIds.isEmpty()) {
      throw new IllegalArgumentException("A question must target at least one competency");
    }
    followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
    if (id == null || id.isBlank()) {
      id = idFor(text);
    }
  }

  public static String idFor(String text) {
    return "q-" + Fingerprints.shortHash(normalize(text), 16);
  }

  /** Id of a question asked for one job; equal texts asked for different jobs get distinct ids. */
  public static String idFor(String jobContextId, String text) {
    return "q-" + Fingerprints.shortHash(jobContextId + "\n" + normalize(text), 16);
  }

  private static String normalize(String text) {
    return text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  /** A copy that additionally targets the given competencies. */
  public Question withAdditionalCompetencies(List<String> additional) {
    Set<String> merged = new LinkedHashSet<>(competencyIds);
    merged.addAll(additional);
    return new Question(id, new ArrayList<>(merged), text, rubric, followUpQuestions);
  }
}
