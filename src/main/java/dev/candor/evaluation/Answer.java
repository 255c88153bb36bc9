package dev.candor.evaluation;

import dev.candor.cache.Fingerprints;
import java.time.Instant;
import java.util.UUID;

/**
 * A candidate's answer to one question.
 *
 * @param id answer id; a random UUID when not supplied
 * @param questionId the question answered
 * @param candidateId the candidate
 * @param text answer text
 * @param submittedAt submission time
 */
public record Answer(
    String id, String questionId, String candidateId, String text, Instant submittedAt) {

  public Answer {
    if (questionId == null || questionId.isBlank()) {
      throw new IllegalArgumentException("questionId must not be blank");
    }
    if (candidateId == null || candidateId.isBlank()) {
      throw new IllegalArgumentException("candidateId must not be blank");
    }
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Answer text must not be blank");
    }
    if (submittedAt == null) {
      throw new IllegalArgumentException("submittedAt must not be null");
    }
    if (id == null || id.isBlank()) {
      id = UUID.randomUUID().toString();
    }
  }

  /** Content fingerprint: identical text for the same question scores identically. */
  public String fingerprint() {
    return Fingerprints.of(questionId, text.strip().replaceAll("\\s+", " "));
  }
}
