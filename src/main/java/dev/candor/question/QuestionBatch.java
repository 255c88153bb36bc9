package dev.candor.question;

import java.util.List;

/** Questions produced by one generation request; the cacheable unit. */
public record QuestionBatch(List<Question> questions) {

  public QuestionBatch {
    questions = List.copyOf(questions);
  }
}
