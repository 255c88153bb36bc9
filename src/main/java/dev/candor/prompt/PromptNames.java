package dev.candor.prompt;

/** Names of the templates the engine renders. */
public final class PromptNames {

  public static final String THOUGHT_CHAIN = "thought-chain";
  public static final String QUESTION_SET = "question-set";
  public static final String QUESTION_COVERAGE = "question-coverage";
  public static final String ANSWER_EVALUATION = "answer-evaluation";

  private PromptNames() {}
}
