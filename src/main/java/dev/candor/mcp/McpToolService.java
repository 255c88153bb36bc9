package dev.candor.mcp;

import dev.candor.evaluation.Answer;
import dev.candor.evaluation.EvaluationUnavailableException;
import dev.candor.explain.DimensionHighlight;
import dev.candor.framework.Competency;
import dev.candor.framework.CompetencyFramework;
import dev.candor.job.JobAttributes;
import dev.candor.job.JobContext;
import dev.candor.job.SeniorityLevel;
import dev.candor.provider.ProviderException;
import dev.candor.question.CoverageException;
import dev.candor.question.Question;
import dev.candor.question.QuestionSet;
import dev.candor.question.ScoringAnchor;
import dev.candor.report.EvaluationReport;
import dev.candor.report.InterviewEvaluationService;
import dev.candor.scoring.PercentileResult;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the evaluation engine as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code generate_framework}, {@code generate_questions}, {@code evaluate_answer}.
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final InterviewEvaluationService service;
  private final TokenBudgetTruncator truncator;
  private final Clock clock;

  public McpToolService(
      InterviewEvaluationService service, TokenBudgetTruncator truncator, Clock clock) {
    this.service = service;
    this.truncator = truncator;
    this.clock = clock;
  }

  @Tool(
      name = "generate_framework",
      description =
          "Derive a weighted competency framework (technical, soft-skill and culture-fit"
              + " competencies) from a job description.")
  public String generateFramework(
      @ToolParam(description = "Full job description text") @Nullable String description,
      @ToolParam(description = "Seniority: JUNIOR, MID, SENIOR or LEAD") @Nullable String seniority,
      @ToolParam(description = "Business or technical domain, e.g. 'payments'", required = false)
          @Nullable String domain,
      @ToolParam(description = "Company size band, e.g. '50-200'", required = false)
          @Nullable String companySize,
      @ToolParam(description = "Comma-separated culture tags", required = false)
          @Nullable String cultureTags) {
    try {
      JobContext job = job(description, seniority, domain, companySize, cultureTags);
      CompetencyFramework framework = service.submitJob(job);
      List<String> blocks = new ArrayList<>();
      for (Competency competency : framework.competencies()) {
        blocks.add(
            String.format(
                Locale.ROOT,
                "- %s [%s] (%s) weight %.3f: %s%n",
                competency.name(),
                competency.id(),
                competency.category(),
                competency.weight(),
                competency.rationale()));
      }
      return truncator.truncate(
          "Framework " + framework.id() + " for job " + job.id() + ":\n", blocks);
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (ProviderException e) {
      return "Error: model providers unavailable (" + e.kind() + "): " + e.getMessage();
    } catch (Exception e) {
      log.warn("generate_framework failed", e);
      return "Error generating framework: " + e.getMessage();
    }
  }

  @Tool(
      name = "generate_questions",
      description =
          "Generate interview questions with scoring rubrics covering every competency of a job's"
              + " framework. Generates the framework first if needed.")
  public String generateQuestions(
      @ToolParam(description = "Full job description text") @Nullable String description,
      @ToolParam(description = "Seniority: JUNIOR, MID, SENIOR or LEAD") @Nullable String seniority,
      @ToolParam(description = "Business or technical domain", required = false)
          @Nullable String domain,
      @ToolParam(description = "Company size band", required = false) @Nullable String companySize,
      @ToolParam(description = "Comma-separated culture tags", required = false)
          @Nullable String cultureTags,
      @ToolParam(
              description = "Accept a set that leaves some competencies uncovered (default false)",
              required = false)
          @Nullable Boolean allowPartial) {
    try {
      JobContext job = job(description, seniority, domain, companySize, cultureTags);
      QuestionSet set = service.generateQuestions(job, Boolean.TRUE.equals(allowPartial));
      return formatQuestionSet(set);
    } catch (CoverageException e) {
      return "Error: incomplete coverage, no question for "
          + e.partialSet().uncoveredCompetencyIds()
          + ". Retry with allowPartial=true to accept the partial set.";
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (ProviderException e) {
      return "Error: model providers unavailable (" + e.kind() + "): " + e.getMessage();
    } catch (Exception e) {
      log.warn("generate_questions failed", e);
      return "Error generating questions: " + e.getMessage();
    }
  }

  @Tool(
      name = "evaluate_answer",
      description =
          "Score a candidate's answer to a generated question on every competency it targets,"
              + " with cohort percentiles and an explanation.")
  public String evaluateAnswer(
      @ToolParam(description = "Question id from generate_questions") @Nullable String questionId,
      @ToolParam(description = "Candidate identifier") @Nullable String candidateId,
      @ToolParam(description = "The candidate's answer text") @Nullable String answerText,
      @ToolParam(description = "Deadline in seconds (default 60)", required = false)
          @Nullable Integer deadlineSeconds) {
    try {
      if (questionId == null || questionId.isBlank()) {
        return "Error: questionId must not be empty.";
      }
      if (candidateId == null || candidateId.isBlank()) {
        return "Error: candidateId must not be empty.";
      }
      if (answerText == null || answerText.isBlank()) {
        return "Error: answer text must not be empty.";
      }
      if (deadlineSeconds != null && deadlineSeconds < 1) {
        return "Error: deadlineSeconds must be positive.";
      }
      Answer answer = new Answer(null, questionId, candidateId, answerText, clock.instant());
      EvaluationReport report =
          service.submitAnswer(
              answer, deadlineSeconds == null ? null : Duration.ofSeconds(deadlineSeconds));
      return formatReport(report);
    } catch (EvaluationUnavailableException e) {
      return "Error: evaluation unavailable, no dimension could be scored: " + e.failures();
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.warn("evaluate_answer failed", e);
      return "Error evaluating answer: " + e.getMessage();
    }
  }

  private static JobContext job(
      @Nullable String description,
      @Nullable String seniority,
      @Nullable String domain,
      @Nullable String companySize,
      @Nullable String cultureTags) {
    if (description == null || description.isBlank()) {
      throw new IllegalArgumentException("Job description must not be empty.");
    }
    if (seniority == null || seniority.isBlank()) {
      throw new IllegalArgumentException(
          "Seniority must not be empty (JUNIOR, MID, SENIOR, LEAD).");
    }
    List<String> tags =
        cultureTags == null || cultureTags.isBlank()
            ? List.of()
            : Arrays.stream(cultureTags.split(","))
                .map(String::strip)
                .filter(t -> !t.isEmpty())
                .toList();
    return JobContext.of(
        description,
        new JobAttributes(SeniorityLevel.parse(seniority), domain, companySize, tags));
  }

  private String formatQuestionSet(QuestionSet set) {
    List<String> blocks = new ArrayList<>();
    for (Question question : set.questions()) {
      StringBuilder block = new StringBuilder();
      block
          .append("## ")
          .append(question.id())
          .append(" ")
          .append(question.competencyIds())
          .append('\n')
          .append(question.text())
          .append('\n');
      question
          .rubric()
          .expectedAnswerComponents()
          .forEach(c -> block.append("  expects: ").append(c).append('\n'));
      for (ScoringAnchor anchor : question.rubric().scoringAnchors()) {
        block
            .append("  ")
            .append(anchor.band())
            .append(": ")
            .append(anchor.description())
            .append('\n');
      }
      question
          .followUpQuestions()
          .forEach(f -> block.append("  follow-up: ").append(f).append('\n'));
      blocks.add(block.append('\n').toString());
    }
    String header =
        "Question set "
            + set.id()
            + " ("
            + set.questions().size()
            + " questions"
            + (set.partialCoverage()
                ? ", PARTIAL: uncovered " + set.uncoveredCompetencyIds()
                : "")
            + "):\n\n";
    return truncator.truncate(header, blocks);
  }

  private String formatReport(EvaluationReport report) {
    StringBuilder header = new StringBuilder();
    header
        .append(
            String.format(
                Locale.ROOT,
                "Answer %s: composite %.3f%s, confidence %s%n",
                report.answer().id(),
                report.composite().raw(),
                report.composite().partial()
                    ? " (partial, failed " + report.composite().failedCompetencyIds() + ")"
                    : "",
                report.explanation().confidence()))
        .append(report.explanation().narrative())
        .append("\n\nPercentiles:\n");
    for (PercentileResult percentile : report.percentiles()) {
      header.append(
          String.format(
              Locale.ROOT,
              "- %s: %.1f (pool %d%s)%n",
              percentile.competencyId(),
              percentile.percentile(),
              percentile.poolSizeAtComputation(),
              percentile.provisional() ? ", provisional" : ""));
    }
    header.append("\nHighlights:\n");
    List<String> blocks = new ArrayList<>();
    for (DimensionHighlight highlight : report.explanation().highlights()) {
      StringBuilder block =
          new StringBuilder(
              String.format(
                  Locale.ROOT,
                  "- %s: score %.2f, contribution %.3f, confidence %.2f%n  %s%n",
                  highlight.competencyId(),
                  highlight.rawScore(),
                  highlight.contribution(),
                  highlight.confidence(),
                  highlight.justification()));
      highlight.positiveSpans().forEach(s -> block.append("  + \"").append(s).append("\"\n"));
      highlight.negativeSpans().forEach(s -> block.append("  - \"").append(s).append("\"\n"));
      blocks.add(block.toString());
    }
    return truncator.truncate(header.toString(), blocks);
  }
}
