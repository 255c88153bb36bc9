package dev.candor.evaluation;

import dev.candor.framework.CompetencyFramework;
import dev.candor.job.JobContext;
import dev.candor.question.QuestionSet;

/** Everything an answer is evaluated against. */
public record EvaluationContext(
    JobContext job, CompetencyFramework framework, QuestionSet questionSet) {}
