package dev.candor.question;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Shape of the {@code question-set} and {@code question-coverage} model output. */
@JsonIgnoreProperties(ignoreUnknown = true)
record QuestionSetResponse(List<Item> questions) {

  QuestionSetResponse {
    questions = questions == null ? List.of() : questions;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Item(
      @Nullable String text,
      @Nullable List<String> competencyIds,
      @Nullable List<String> expectedAnswerComponents,
      @Nullable List<Anchor> scoringAnchors,
      @Nullable List<String> followUpQuestions) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Anchor(@Nullable String band, @Nullable String description) {}
}
