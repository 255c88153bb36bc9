package dev.candor.question;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.candor.cache.Fingerprints;
import dev.candor.cache.ResponseCache;
import dev.candor.framework.Competency;
import dev.candor.framework.CompetencyFramework;
import dev.candor.job.JobContext;
import dev.candor.prompt.PromptNames;
import dev.candor.prompt.PromptRegistry;
import dev.candor.prompt.PromptTemplate;
import dev.candor.prompt.PromptVariables;
import dev.candor.prompt.VariantSelector;
import dev.candor.provider.CompletionResult;
import dev.candor.provider.ProviderErrorKind;
import dev.candor.provider.ProviderException;
import dev.candor.provider.ProviderGateway;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Generates a rubric-backed {@link QuestionSet} covering every competency of a framework.
 *
 * <ol>
 *   <li>one concurrent {@code question-set} request per competency, each cached
 *   <li>near-duplicate questions merged by {@link QuestionDeduplicator}
 *   <li>one corrective {@code question-coverage} request per competency still uncovered
 *   <li>{@link CoverageException} carrying the flagged partial set if coverage is still incomplete
 * </ol>
 */
@Service
public class QuestionGenerator {

  private static final Logger log = LoggerFactory.getLogger(QuestionGenerator.class);

  private static final Set<String> REQUIRED_FIELDS = Set.of("questions");

  private final ProviderGateway gateway;
  private final PromptRegistry promptRegistry;
  private final ResponseCache responseCache;
  private final QuestionDeduplicator deduplicator;
  private final QuestionProperties properties;
  private final ExecutorService executor;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public QuestionGenerator(
      ProviderGateway gateway,
      PromptRegistry promptRegistry,
      ResponseCache responseCache,
      QuestionDeduplicator deduplicator,
      QuestionProperties properties,
      @Qualifier("evaluationExecutor") ExecutorService executor,
      ObjectMapper objectMapper,
      Clock clock) {
    this.gateway = gateway;
    this.promptRegistry = promptRegistry;
    this.responseCache = responseCache;
    this.deduplicator = deduplicator;
    this.properties = properties;
    this.executor = executor;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Generates the question set for a framework.
   *
   * @throws CoverageException if a competency stays uncovered; carries the partial set
   * @throws ProviderException if no request produced any question because the gateway failed
   * @throws CancellationException if the calling thread is interrupted
   */
  public QuestionSet generate(JobContext job, CompetencyFramework framework) {
    VariantSelector selector = VariantSelector.of(job.id());
    PromptTemplate template = promptRegistry.resolve(PromptNames.QUESTION_SET, selector);

    List<Callable<QuestionBatch>> tasks = new ArrayList<>();
    for (Competency competency : framework.competencies()) {
      tasks.add(() -> initialBatch(job, framework, competency, template));
    }
    List<ProviderException> failures = new ArrayList<>();
    List<Question> questions = new ArrayList<>();
    collect(invokeAll(tasks), framework.competencies(), questions, failures);
    questions = deduplicator.deduplicate(questions);

    List<String> uncovered = uncovered(framework, questions);
    if (!uncovered.isEmpty()) {
      log.warn(
          "Competencies {} uncovered for {}, requesting corrective questions",
          uncovered,
          framework.id());
      PromptTemplate coverage = promptRegistry.resolve(PromptNames.QUESTION_COVERAGE, selector);
      List<Question> snapshot = List.copyOf(questions);
      List<Competency> targets = new ArrayList<>();
      List<Callable<QuestionBatch>> corrective = new ArrayList<>();
      for (String competencyId : uncovered) {
        Competency competency = framework.competency(competencyId).orElseThrow();
        targets.add(competency);
        corrective.add(() -> correctiveBatch(job, framework, competency, coverage, snapshot));
      }
      List<Question> combined = new ArrayList<>(questions);
      collect(invokeAll(corrective), targets, combined, failures);
      questions = deduplicator.deduplicate(combined);
      uncovered = uncovered(framework, questions);
    }

    if (questions.isEmpty() && !failures.isEmpty()) {
      throw failures.get(0);
    }

    QuestionSet set =
        new QuestionSet(
            null,
            job.id(),
            framework.promptVersion(),
            questions,
            new GenerationMetadata(template.qualifiedVersion(), clock.instant()),
            uncovered);
    if (set.partialCoverage()) {
      log.warn("Question set {} leaves competencies {} uncovered", set.id(), uncovered);
      throw new CoverageException(set);
    }
    log.info(
        "Generated question set {} with {} questions for {}",
        set.id(),
        questions.size(),
        framework.id());
    return set;
  }

  private QuestionBatch initialBatch(
      JobContext job,
      CompetencyFramework framework,
      Competency competency,
      PromptTemplate template) {
    String prompt = template.render(baseVariables(job, framework, competency).build());
    String fingerprint =
        Fingerprints.of(template.qualifiedVersion(), prompt, framework.id(), competency.id());
    return responseCache.getOrCompute(
        fingerprint,
        QuestionBatch.class,
        () -> request(prompt, template, framework, competency, false));
  }

  private QuestionBatch correctiveBatch(
      JobContext job,
      CompetencyFramework framework,
      Competency competency,
      PromptTemplate template,
      List<Question> existing) {
    String prompt =
        template.render(
            baseVariables(job, framework, competency)
                .putList("existing_questions", existing.stream().map(Question::text).toList())
                .build());
    String fingerprint =
        Fingerprints.of(template.qualifiedVersion(), prompt, framework.id(), competency.id());
    return responseCache.getOrCompute(
        fingerprint,
        QuestionBatch.class,
        () -> request(prompt, template, framework, competency, true));
  }

  private QuestionBatch request(
      String prompt,
      PromptTemplate template,
      CompetencyFramework framework,
      Competency competency,
      boolean forceCompetency) {
    CompletionResult result =
        gateway.completeStructured(prompt, null, gateway.defaultConfig(), REQUIRED_FIELDS);
    QuestionSetResponse response;
    try {
      response = objectMapper.treeToValue(result.structured(), QuestionSetResponse.class);
    } catch (JsonProcessingException e) {
      throw new ProviderException(
          ProviderErrorKind.MALFORMED_RESPONSE,
          result.provider(),
          "Unexpected question-set shape: " + e.getOriginalMessage(),
          e);
    }
    List<Question> questions = new ArrayList<>();
    for (QuestionSetResponse.Item item : response.questions()) {
      if (questions.size() >= properties.getMaxPerCompetency()) {
        log.debug(
            "Truncating questions for {} to {}", competency.id(), properties.getMaxPerCompetency());
        break;
      }
      if (item == null || item.text() == null || item.text().isBlank()) {
        continue;
      }
      questions.add(toQuestion(item, template, framework, competency, forceCompetency));
    }
    return new QuestionBatch(questions);
  }

  static Question toQuestion(
      QuestionSetResponse.Item item,
      PromptTemplate template,
      CompetencyFramework framework,
      Competency requested,
      boolean forceCompetency) {
    Set<String> competencyIds = new LinkedHashSet<>();
    if (item.competencyIds() != null) {
      for (String raw : item.competencyIds()) {
        String resolved = resolveCompetencyId(framework, raw);
        if (resolved != null) {
          competencyIds.add(resolved);
        }
      }
    }
    if (competencyIds.isEmpty() || forceCompetency) {
      competencyIds.add(requested.id());
    }
    List<ScoringAnchor> anchors = new ArrayList<>();
    if (item.scoringAnchors() != null) {
      for (QuestionSetResponse.Anchor anchor : item.scoringAnchors()) {
        if (anchor != null && anchor.band() != null && anchor.description() != null) {
          anchors.add(new ScoringAnchor(anchor.band().strip(), anchor.description().strip()));
        }
      }
    }
    List<String> components =
        item.expectedAnswerComponents() == null
            ? List.of()
            : item.expectedAnswerComponents().stream()
                .filter(c -> c != null && !c.isBlank())
                .toList();
    List<String> followUps =
        item.followUpQuestions() == null
            ? List.of()
            : item.followUpQuestions().stream().filter(f -> f != null && !f.isBlank()).toList();
    String text = item.text().strip();
    return new Question(
        Question.idFor(framework.jobContextId(), text),
        new ArrayList<>(competencyIds),
        text,
        Rubric.of(template.qualifiedVersion(), components, anchors),
        followUps);
  }

  /** Matches a model-supplied competency reference by id or by name. */
  static @Nullable String resolveCompetencyId(CompetencyFramework framework, @Nullable String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String slug = Competency.slug(raw);
    for (Competency competency : framework.competencies()) {
      if (competency.id().equals(raw.strip()) || competency.id().equals(slug)) {
        return competency.id();
      }
    }
    return null;
  }

  private static List<String> uncovered(CompetencyFramework framework, List<Question> questions) {
    Set<String> covered = new LinkedHashSet<>();
    questions.forEach(q -> covered.addAll(q.competencyIds()));
    return framework.competencies().stream()
        .map(Competency::id)
        .filter(id -> !covered.contains(id))
        .toList();
  }

  private PromptVariables.Builder baseVariables(
      JobContext job, CompetencyFramework framework, Competency competency) {
    Map<String, String> catalogue = new LinkedHashMap<>();
    framework.competencies().forEach(c -> catalogue.put(c.id(), c.name()));
    return PromptVariables.builder()
        .put("description", job.description())
        .put("seniority", job.attributes().seniority().name())
        .put("expectation_bar", job.attributes().seniority().expectationBar())
        .put("competency_id", competency.id())
        .put("competency_name", competency.name())
        .put("competency_category", competency.category().name())
        .put(
            "competency_rationale",
            competency.rationale().isBlank() ? "(none)" : competency.rationale())
        .putList(
            "competency_catalogue",
            catalogue.entrySet().stream().map(e -> e.getKey() + " (" + e.getValue() + ")").toList())
        .put("max_questions", properties.getMaxPerCompetency());
  }

  private List<Future<QuestionBatch>> invokeAll(List<Callable<QuestionBatch>> tasks) {
    try {
      return executor.invokeAll(tasks);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while generating questions");
    }
  }

  private static void collect(
      List<Future<QuestionBatch>> futures,
      List<Competency> competencies,
      List<Question> questions,
      List<ProviderException> failures) {
    for (int i = 0; i < futures.size(); i++) {
      try {
        questions.addAll(futures.get(i).get().questions());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancellationException("Interrupted while generating questions");
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ProviderException providerError) {
          log.warn(
              "Question generation for {} failed: {}",
              competencies.get(i).id(),
              providerError.getMessage());
          failures.add(providerError);
        } else if (cause instanceof RuntimeException runtime) {
          throw runtime;
        } else {
          throw new IllegalStateException("Question generation failed", cause);
        }
      }
    }
  }
}
