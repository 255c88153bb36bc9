package dev.candor.report;

/** Application event published after a report has been persisted. */
public record EvaluationReportCompleted(EvaluationReport report) {}
