package dev.candor.report;

/** Locates the question set, and through it the job, a question belongs to. */
record QuestionIndexEntry(String questionSetId, String jobContextId) {}
