package dev.candor.config;

import dev.candor.evaluation.EvaluationUnavailableException;
import dev.candor.framework.FrameworkValidationException;
import dev.candor.provider.ProviderException;
import dev.candor.question.CoverageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps engine exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} - 400 Bad Request
 *   <li>{@link CoverageException}, {@link FrameworkValidationException} - 422 Unprocessable Entity
 *   <li>{@link ProviderException} - 502 Bad Gateway
 *   <li>{@link EvaluationUnavailableException} - 503 Service Unavailable
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(CoverageException.class)
  ProblemDetail handleCoverage(CoverageException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    problem.setTitle("Incomplete competency coverage");
    problem.setProperty("questionSetId", ex.partialSet().id());
    problem.setProperty("uncoveredCompetencyIds", ex.partialSet().uncoveredCompetencyIds());
    return problem;
  }

  @ExceptionHandler(FrameworkValidationException.class)
  ProblemDetail handleFrameworkValidation(FrameworkValidationException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    problem.setTitle("Invalid competency framework");
    return problem;
  }

  @ExceptionHandler(ProviderException.class)
  ProblemDetail handleProvider(ProviderException ex) {
    log.warn("Provider failure surfaced to client: {} {}", ex.kind(), ex.getMessage());
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, ex.getMessage());
    problem.setTitle("Model provider failure");
    problem.setProperty("kind", ex.kind().name());
    return problem;
  }

  @ExceptionHandler(EvaluationUnavailableException.class)
  ProblemDetail handleEvaluationUnavailable(EvaluationUnavailableException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    problem.setTitle("Evaluation unavailable");
    problem.setProperty("failures", ex.failures());
    return problem;
  }
}
