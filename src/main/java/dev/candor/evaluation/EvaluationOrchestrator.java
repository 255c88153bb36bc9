package dev.candor.evaluation;

import dev.candor.framework.Competency;
import dev.candor.question.Question;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Evaluates an answer on every competency its question targets, concurrently and under a deadline.
 *
 * <p>Dimensions still running at the deadline are cancelled (interrupted) and count as failed.
 * Failed dimensions' weight is redistributed over the successful ones and the composite is flagged
 * partial; if nothing succeeds {@link EvaluationUnavailableException} is thrown.
 */
@Service
public class EvaluationOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);

  static final String DEADLINE_EXCEEDED = "deadline exceeded";

  private final DimensionEvaluator evaluator;
  private final ExecutorService executor;

  public EvaluationOrchestrator(
      DimensionEvaluator evaluator, @Qualifier("evaluationExecutor") ExecutorService executor) {
    this.evaluator = evaluator;
    this.executor = executor;
  }

  /**
   * Scores the answer.
   *
   * @throws IllegalArgumentException if the answer's question is not part of the question set
   * @throws EvaluationUnavailableException if every dimension failed
   * @throws CancellationException if the calling thread is interrupted
   */
  public CompositeScore evaluate(Answer answer, EvaluationContext context, Duration deadline) {
    Question question =
        context
            .questionSet()
            .question(answer.questionId())
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Unknown question "
                            + answer.questionId()
                            + " in question set "
                            + context.questionSet().id()));

    List<Competency> targets = new ArrayList<>();
    Map<String, Double> weights = new LinkedHashMap<>();
    for (String competencyId : question.competencyIds()) {
      Competency competency =
          context
              .framework()
              .competency(competencyId)
              .orElseThrow(
                  () ->
                      new IllegalArgumentException(
                          "Question "
                              + question.id()
                              + " targets competency "
                              + competencyId
                              + " missing from framework "
                              + context.framework().id()));
      targets.add(competency);
      weights.put(competency.id(), competency.weight());
    }

    List<Callable<DimensionScore>> tasks = new ArrayList<>();
    for (Competency competency : targets) {
      tasks.add(() -> evaluator.evaluate(answer, question, competency, context.job()));
    }

    List<Future<DimensionScore>> futures;
    try {
      futures = executor.invokeAll(tasks, deadline.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while evaluating answer " + answer.id());
    }

    List<DimensionScore> successes = new ArrayList<>();
    Map<String, String> failures = new LinkedHashMap<>();
    for (int i = 0; i < futures.size(); i++) {
      String competencyId = targets.get(i).id();
      Future<DimensionScore> future = futures.get(i);
      if (future.isCancelled()) {
        failures.put(competencyId, DEADLINE_EXCEEDED);
        continue;
      }
      try {
        successes.add(future.get());
      } catch (CancellationException e) {
        failures.put(competencyId, DEADLINE_EXCEEDED);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancellationException("Interrupted while evaluating answer " + answer.id());
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        String reason =
            cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        log.warn("Dimension {} of answer {} failed: {}", competencyId, answer.id(), reason);
        failures.put(competencyId, reason);
      }
    }

    if (successes.isEmpty()) {
      throw new EvaluationUnavailableException(answer.id(), failures);
    }
    CompositeScore composite =
        CompositeScore.aggregate(
            answer.id(), question.id(), weights, successes, new ArrayList<>(failures.keySet()));
    if (composite.partial()) {
      log.warn(
          "Answer {} scored partially; failed dimensions {}",
          answer.id(),
          composite.failedCompetencyIds());
    }
    return composite;
  }
}
