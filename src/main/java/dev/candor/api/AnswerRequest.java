package dev.candor.api;

import dev.candor.evaluation.Answer;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/** Request body submitting one answer; {@code deadlineSeconds} overrides the default deadline. */
public record AnswerRequest(
    @Nullable String answerId,
    @NotBlank String questionId,
    @NotBlank String candidateId,
    @NotBlank @Size(max = 50_000) String text,
    @Nullable @Positive Integer deadlineSeconds) {

  public Answer toAnswer(Instant submittedAt) {
    return new Answer(answerId, questionId, candidateId, text, submittedAt);
  }

  public @Nullable Duration deadline() {
    return deadlineSeconds == null ? null : Duration.ofSeconds(deadlineSeconds);
  }
}
