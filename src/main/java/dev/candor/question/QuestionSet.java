package dev.candor.question;

import dev.candor.cache.Fingerprints;
import java.util.List;
import java.util.Optional;

/**
 * Questions generated for one framework.
 *
 * @param id {@code qs-} plus a hash of the framework and question ids
 * @param jobContextId owning job
 * @param frameworkPromptVersion prompt version of the framework the questions were generated from
 * @param questions deduplicated questions
 * @param metadata generation metadata
 * @param uncoveredCompetencyIds framework competencies no question targets; non-empty only for
 *     sets explicitly accepted as partial
 */
public record QuestionSet(
    String id,
    String jobContextId,
    String frameworkPromptVersion,
    List<Question> questions,
    GenerationMetadata metadata,
    List<String> uncoveredCompetencyIds) {

  public QuestionSet {
    questions = List.copyOf(questions);
    uncoveredCompetencyIds =
        uncoveredCompetencyIds == null ? List.of() : List.copyOf(uncoveredCompetencyIds);
    if (id == null || id.isBlank()) {
      StringBuilder content = new StringBuilder();
      questions.forEach(q -> content.append(q.id()).append(','));
      id =
          "qs-"
              + Fingerprints.of(jobContextId, frameworkPromptVersion, content.toString())
                  .substring(0, 16);
    }
  }

  public boolean partialCoverage() {
    return !uncoveredCompetencyIds.isEmpty();
  }

  /** Id of the framework the set was generated from. */
  public String frameworkId() {
    return jobContextId + "@" + frameworkPromptVersion;
  }

  public Optional<Question> question(String questionId) {
    return questions.stream().filter(q -> q.id().equals(questionId)).findFirst();
  }
}
