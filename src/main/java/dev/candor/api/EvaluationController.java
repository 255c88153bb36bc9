package dev.candor.api;

import dev.candor.framework.CompetencyFramework;
import dev.candor.question.QuestionSet;
import dev.candor.report.EvaluationReport;
import dev.candor.report.InterviewEvaluationService;
import jakarta.validation.Valid;
import java.time.Clock;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the evaluation engine. Errors are rendered as Problem Details by {@link
 * dev.candor.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class EvaluationController {

  private final InterviewEvaluationService service;
  private final Clock clock;

  public EvaluationController(InterviewEvaluationService service, Clock clock) {
    this.service = service;
    this.clock = clock;
  }

  @PostMapping("/jobs/framework")
  public CompetencyFramework generateFramework(@Valid @RequestBody JobRequest request) {
    return service.submitJob(request.toJobContext());
  }

  @PostMapping("/jobs/questions")
  public QuestionSet generateQuestions(
      @Valid @RequestBody JobRequest request,
      @RequestParam(name = "allowPartial", defaultValue = "false") boolean allowPartial) {
    return service.generateQuestions(request.toJobContext(), allowPartial);
  }

  @PostMapping("/answers")
  public EvaluationReport submitAnswer(@Valid @RequestBody AnswerRequest request) {
    return service.submitAnswer(request.toAnswer(clock.instant()), request.deadline());
  }

  @GetMapping("/answers/{answerId}/report")
  public ResponseEntity<EvaluationReport> report(@PathVariable String answerId) {
    return ResponseEntity.of(service.findReport(answerId));
  }
}
