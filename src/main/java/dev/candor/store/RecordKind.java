package dev.candor.store;

/** Artifact kinds kept in the evaluation store. */
public enum RecordKind {
  JOB_CONTEXT,
  COMPETENCY_FRAMEWORK,
  QUESTION_SET,
  /** Maps a question id to the question set that contains it. */
  QUESTION_INDEX,
  ANSWER,
  DIMENSION_SCORE,
  COMPOSITE_SCORE,
  PERCENTILE_RESULT,
  EXPLANATION,
  REPORT
}
