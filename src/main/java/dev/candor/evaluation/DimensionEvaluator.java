package dev.candor.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.candor.cache.Fingerprints;
import dev.candor.cache.ResponseCache;
import dev.candor.framework.Competency;
import dev.candor.job.JobContext;
import dev.candor.job.SeniorityLevel;
import dev.candor.prompt.PromptNames;
import dev.candor.prompt.PromptRegistry;
import dev.candor.prompt.PromptTemplate;
import dev.candor.prompt.PromptVariables;
import dev.candor.prompt.VariantSelector;
import dev.candor.provider.CompletionResult;
import dev.candor.provider.ProviderErrorKind;
import dev.candor.provider.ProviderException;
import dev.candor.provider.ProviderGateway;
import dev.candor.question.Question;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores one answer on one competency against the question's rubric, with the rubric annotated by
 * the role's seniority expectation bar. Results are cached by answer content, competency, rubric
 * version and template version, so re-submitting identical text never re-spends a provider call.
 */
@Component
public class DimensionEvaluator {

  private static final Logger log = LoggerFactory.getLogger(DimensionEvaluator.class);

  private static final Set<String> REQUIRED_FIELDS = Set.of("score", "justification");
  private static final double DEFAULT_CONFIDENCE = 0.5;

  private final ProviderGateway gateway;
  private final PromptRegistry promptRegistry;
  private final ResponseCache responseCache;
  private final EvaluationProperties properties;
  private final ObjectMapper objectMapper;

  public DimensionEvaluator(
      ProviderGateway gateway,
      PromptRegistry promptRegistry,
      ResponseCache responseCache,
      EvaluationProperties properties,
      ObjectMapper objectMapper) {
    this.gateway = gateway;
    this.promptRegistry = promptRegistry;
    this.responseCache = responseCache;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  public DimensionScore evaluate(
      Answer answer, Question question, Competency competency, JobContext job) {
    PromptTemplate template =
        promptRegistry.resolve(
            PromptNames.ANSWER_EVALUATION, VariantSelector.of(answer.candidateId()));
    SeniorityLevel seniority = job.attributes().seniority();
    String prompt =
        template.render(
            PromptVariables.builder()
                .put("question", question.text())
                .put("competency_id", competency.id())
                .put("competency_name", competency.name())
                .put("competency_category", competency.category().name())
                .put("seniority", seniority.name())
                .put("rubric", annotatedRubric(question, seniority))
                .put("answer", answer.text())
                .build());
    String fingerprint =
        Fingerprints.of(
            template.qualifiedVersion(),
            answer.fingerprint(),
            competency.id(),
            question.rubric().version());
    DimensionScore score =
        responseCache.getOrCompute(
            fingerprint, DimensionScore.class, () -> request(prompt, answer, question, competency));
    return score.forAnswer(answer.id());
  }

  static String annotatedRubric(Question question, SeniorityLevel seniority) {
    return question.rubric().render()
        + "\nExpectation bar for a "
        + seniority.name()
        + " candidate: "
        + seniority.expectationBar();
  }

  private DimensionScore request(
      String prompt, Answer answer, Question question, Competency competency) {
    CompletionResult result =
        gateway.completeStructured(
            prompt,
            null,
            gateway.defaultConfig().withTemperature(properties.getTemperature()),
            REQUIRED_FIELDS);
    DimensionEvaluationResponse response;
    try {
      response = objectMapper.treeToValue(result.structured(), DimensionEvaluationResponse.class);
    } catch (JsonProcessingException e) {
      throw new ProviderException(
          ProviderErrorKind.MALFORMED_RESPONSE,
          result.provider(),
          "Unexpected answer-evaluation shape: " + e.getOriginalMessage(),
          e);
    }
    List<ContributingSpan> spans = new ArrayList<>();
    if (response.spans() != null) {
      for (DimensionEvaluationResponse.Span span : response.spans()) {
        if (span != null && span.text() != null && !span.text().isBlank()) {
          spans.add(new ContributingSpan(span.text().strip(), SpanPolarity.parse(span.polarity())));
        }
      }
    }
    double raw = clamp(response.score(), competency.id(), "score");
    double confidence =
        response.confidence() == null
            ? DEFAULT_CONFIDENCE
            : clamp(response.confidence(), competency.id(), "confidence");
    return new DimensionScore(
        answer.id(),
        competency.id(),
        question.rubric().version(),
        raw,
        confidence,
        response.justification() == null ? "" : response.justification().strip(),
        spans);
  }

  private static double clamp(Double value, String competencyId, String field) {
    if (value == null || value.isNaN()) {
      return 0.0;
    }
    if (value < 0.0 || value > 1.0) {
      log.debug("Clamping out-of-range {} {} for {}", field, value, competencyId);
    }
    return Math.min(1.0, Math.max(0.0, value));
  }
}
