package dev.candor.report;

import dev.candor.evaluation.Answer;
import dev.candor.evaluation.CompositeScore;
import dev.candor.evaluation.DimensionScore;
import dev.candor.evaluation.EvaluationContext;
import dev.candor.evaluation.EvaluationOrchestrator;
import dev.candor.evaluation.EvaluationProperties;
import dev.candor.explain.ExplainabilityComposer;
import dev.candor.explain.ExplanationArtifact;
import dev.candor.framework.CompetencyFramework;
import dev.candor.framework.ThoughtChainGenerator;
import dev.candor.job.JobContext;
import dev.candor.question.CoverageException;
import dev.candor.question.Question;
import dev.candor.question.QuestionGenerator;
import dev.candor.question.QuestionSet;
import dev.candor.scoring.CohortKey;
import dev.candor.scoring.PercentileResult;
import dev.candor.scoring.RecordOutcome;
import dev.candor.scoring.ScoringPoolRegistry;
import dev.candor.store.EvaluationStore;
import dev.candor.store.RecordKind;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Consumer-facing operations of the engine: submit a job, generate its questions, and evaluate
 * answers. Every artifact is persisted to the {@link EvaluationStore}; completed reports are
 * announced with an {@link EvaluationReportCompleted} event.
 */
@Service
public class InterviewEvaluationService {

  private static final Logger log = LoggerFactory.getLogger(InterviewEvaluationService.class);

  private final ThoughtChainGenerator thoughtChainGenerator;
  private final QuestionGenerator questionGenerator;
  private final EvaluationOrchestrator orchestrator;
  private final ScoringPoolRegistry scoringPools;
  private final ExplainabilityComposer composer;
  private final EvaluationStore store;
  private final EvaluationProperties evaluationProperties;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public InterviewEvaluationService(
      ThoughtChainGenerator thoughtChainGenerator,
      QuestionGenerator questionGenerator,
      EvaluationOrchestrator orchestrator,
      ScoringPoolRegistry scoringPools,
      ExplainabilityComposer composer,
      EvaluationStore store,
      EvaluationProperties evaluationProperties,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.thoughtChainGenerator = thoughtChainGenerator;
    this.questionGenerator = questionGenerator;
    this.orchestrator = orchestrator;
    this.scoringPools = scoringPools;
    this.composer = composer;
    this.store = store;
    this.evaluationProperties = evaluationProperties;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /** Generates and persists the competency framework of a job. */
  public CompetencyFramework submitJob(JobContext job) {
    store.save(RecordKind.JOB_CONTEXT, job.id(), job);
    CompetencyFramework framework = thoughtChainGenerator.generate(job);
    store.save(RecordKind.COMPETENCY_FRAMEWORK, framework.id(), framework);
    store.save(RecordKind.COMPETENCY_FRAMEWORK, job.id(), framework);
    return framework;
  }

  /**
   * Generates and persists the question set of a job, generating its framework first if needed.
   *
   * @param allowPartialCoverage accept a set that leaves competencies uncovered (flagged) instead
   *     of failing
   * @throws CoverageException if coverage is incomplete and partial sets are not allowed
   */
  public QuestionSet generateQuestions(JobContext job, boolean allowPartialCoverage) {
    CompetencyFramework framework =
        store
            .find(RecordKind.COMPETENCY_FRAMEWORK, job.id(), CompetencyFramework.class)
            .orElseGet(() -> submitJob(job));
    QuestionSet set;
    try {
      set = questionGenerator.generate(job, framework);
    } catch (CoverageException e) {
      if (!allowPartialCoverage) {
        throw e;
      }
      set = e.partialSet();
      log.warn(
          "Accepting partial question set {} for {}; uncovered {}",
          set.id(),
          job.id(),
          set.uncoveredCompetencyIds());
    }
    for (Question question : set.questions()) {
      Optional<QuestionIndexEntry> indexed =
          store.find(RecordKind.QUESTION_INDEX, question.id(), QuestionIndexEntry.class);
      if (indexed.isPresent() && !indexed.get().jobContextId().equals(job.id())) {
        throw new IllegalStateException(
            "Question "
                + question.id()
                + " of job "
                + job.id()
                + " is already indexed for job "
                + indexed.get().jobContextId());
      }
    }
    store.save(RecordKind.QUESTION_SET, set.id(), set);
    for (Question question : set.questions()) {
      store.save(
          RecordKind.QUESTION_INDEX, question.id(), new QuestionIndexEntry(set.id(), job.id()));
    }
    return set;
  }

  /**
   * Evaluates an answer and persists every artifact of the evaluation. An answer id that already
   * has a report gets that report back; its scores are not recorded into the pools again.
   *
   * @param deadline evaluation deadline; null uses {@code candor.evaluation.default-deadline}
   * @throws IllegalArgumentException if the answered question is unknown
   */
  public EvaluationReport submitAnswer(Answer answer, @Nullable Duration deadline) {
    Optional<EvaluationReport> existing = findReport(answer.id());
    if (existing.isPresent()) {
      log.info("Answer {} was already evaluated, returning the stored report", answer.id());
      return existing.get();
    }
    EvaluationContext context = contextFor(answer);
    store.save(RecordKind.ANSWER, answer.id(), answer);

    CompositeScore composite =
        orchestrator.evaluate(
            answer,
            context,
            deadline == null ? evaluationProperties.getDefaultDeadline() : deadline);

    String family = context.job().attributes().family();
    List<PercentileResult> percentiles = new ArrayList<>();
    for (DimensionScore dimension : composite.dimensions()) {
      store.save(
          RecordKind.DIMENSION_SCORE, answer.id() + "/" + dimension.competencyId(), dimension);
      CohortKey cohort = new CohortKey(family, dimension.competencyId());
      percentiles.add(score(cohort, answer.id(), dimension.rawScore()));
    }
    percentiles.add(score(CohortKey.overall(family), answer.id(), composite.raw()));

    ExplanationArtifact explanation = composer.compose(composite, percentiles);
    boolean provisional = percentiles.stream().anyMatch(PercentileResult::provisional);
    EvaluationReport report =
        new EvaluationReport(
            answer, composite, percentiles, explanation, provisional, clock.instant());

    store.save(RecordKind.COMPOSITE_SCORE, answer.id(), composite);
    for (PercentileResult percentile : percentiles) {
      store.save(
          RecordKind.PERCENTILE_RESULT, answer.id() + "/" + percentile.competencyId(), percentile);
    }
    store.save(RecordKind.EXPLANATION, answer.id(), explanation);
    store.save(RecordKind.REPORT, answer.id(), report);
    log.info(
        "Evaluated answer {} to question {}: composite {} (partial={}, confidence={})",
        answer.id(),
        answer.questionId(),
        String.format("%.3f", composite.raw()),
        composite.partial(),
        explanation.confidence());

    eventPublisher.publishEvent(new EvaluationReportCompleted(report));
    return report;
  }

  public Optional<EvaluationReport> findReport(String answerId) {
    return store.find(RecordKind.REPORT, answerId, EvaluationReport.class);
  }

  private PercentileResult score(CohortKey cohort, String answerId, double rawScore) {
    RecordOutcome outcome = scoringPools.record(cohort, rawScore);
    return scoringPools.percentile(cohort, answerId, rawScore, outcome.outlier());
  }

  private EvaluationContext contextFor(Answer answer) {
    QuestionIndexEntry index =
        store
            .find(RecordKind.QUESTION_INDEX, answer.questionId(), QuestionIndexEntry.class)
            .orElseThrow(
                () -> new IllegalArgumentException("Unknown question: " + answer.questionId()));
    QuestionSet set =
        require(RecordKind.QUESTION_SET, index.questionSetId(), QuestionSet.class);
    JobContext job = require(RecordKind.JOB_CONTEXT, index.jobContextId(), JobContext.class);
    CompetencyFramework framework =
        require(RecordKind.COMPETENCY_FRAMEWORK, set.frameworkId(), CompetencyFramework.class);
    return new EvaluationContext(job, framework, set);
  }

  private <T> T require(RecordKind kind, String id, Class<T> type) {
    return store
        .find(kind, id, type)
        .orElseThrow(() -> new IllegalStateException("Missing stored " + kind + " " + id));
  }
}
