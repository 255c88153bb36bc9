package dev.candor.question;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.candor.cache.CacheProperties;
import dev.candor.cache.ResponseCache;
import dev.candor.fixture.BagOfWordsEmbeddingModel;
import dev.candor.fixture.FrameworkBuilder;
import dev.candor.fixture.Gateways;
import dev.candor.fixture.InMemorySharedStore;
import dev.candor.fixture.MutableClock;
import dev.candor.fixture.Prompts;
import dev.candor.fixture.ScriptedProvider;
import dev.candor.framework.CompetencyFramework;
import dev.candor.job.JobContext;
import dev.candor.provider.ProviderErrorKind;
import dev.candor.provider.ProviderException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QuestionGeneratorTest {

  private static final Pattern COMPETENCY_LINE = Pattern.compile("- id: ([a-z0-9-]+)");
  private static final String COVERAGE_MARKER = "Questions already in the set";
  private static final String GC_QUESTION =
      "Walk me through how the JVM garbage collector reclaims memory.";
  private static final String FEEDBACK_QUESTION =
      "Describe a time you had to deliver difficult feedback.";

  private ExecutorService providerExecutor;
  private ExecutorService evaluationExecutor;
  private MutableClock clock;
  private QuestionProperties properties;
  private final FrameworkBuilder frameworks = new FrameworkBuilder();
  private JobContext job;
  private CompetencyFramework framework;

  @BeforeEach
  void setUp() {
    providerExecutor = Executors.newCachedThreadPool();
    evaluationExecutor = Executors.newFixedThreadPool(4);
    clock = MutableClock.atEpochDay();
    properties = new QuestionProperties();
    job = frameworks.job();
    framework = frameworks.build();
  }

  @AfterEach
  void tearDown() {
    providerExecutor.shutdownNow();
    evaluationExecutor.shutdownNow();
  }

  private QuestionGenerator generator(ScriptedProvider provider) {
    ResponseCache cache =
        new ResponseCache(
            new CacheProperties(),
            new InMemorySharedStore(clock),
            new ObjectMapper().findAndRegisterModules(),
            clock);
    return new QuestionGenerator(
        Gateways.gateway(providerExecutor, Gateways.fastProperties(), provider),
        Prompts.bundled(),
        cache,
        new QuestionDeduplicator(new BagOfWordsEmbeddingModel(), properties),
        properties,
        evaluationExecutor,
        new ObjectMapper(),
        clock);
  }

  static String competencyOf(String prompt) {
    Matcher matcher = COMPETENCY_LINE.matcher(prompt);
    if (!matcher.find()) {
      throw new IllegalArgumentException("no competency in prompt");
    }
    return matcher.group(1);
  }

  static String item(String text, String... competencyIds) {
    List<String> quoted = new ArrayList<>();
    for (String id : competencyIds) {
      quoted.add("\"" + id + "\"");
    }
    return "{\"text\": \""
        + text
        + "\", \"competencyIds\": ["
        + String.join(", ", quoted)
        + "], \"expectedAnswerComponents\": [\"a concrete example\"],"
        + " \"scoringAnchors\": [{\"band\": \"strong\", \"description\": \"specific and reflective\"}],"
        + " \"followUpQuestions\": [\"What would you change?\"]}";
  }

  static String questions(String... items) {
    return "{\"questions\": [" + String.join(", ", items) + "]}";
  }

  private static Function<String, String> perCompetency() {
    return prompt -> {
      String id = competencyOf(prompt);
      return id.equals("java")
          ? questions(item(GC_QUESTION, "java"))
          : questions(item("Tell me about explaining a technical trade-off to product managers.", id));
    };
  }

  @Test
  void sameQuestionTextGetsDistinctIdsAcrossJobs() {
    ScriptedProvider provider = new ScriptedProvider("p", perCompetency());
    FrameworkBuilder otherJob =
        new FrameworkBuilder()
            .description("Junior store associate handling tills and stock in a retail chain.");
    QuestionGenerator generator = generator(provider);

    QuestionSet first = generator.generate(job, framework);
    QuestionSet second = generator.generate(otherJob.job(), otherJob.build());

    Question firstGc = first.questions().stream()
        .filter(q -> q.text().equals(GC_QUESTION)).findFirst().orElseThrow();
    Question secondGc = second.questions().stream()
        .filter(q -> q.text().equals(GC_QUESTION)).findFirst().orElseThrow();
    assertThat(firstGc.id()).isEqualTo(Question.idFor(job.id(), GC_QUESTION));
    assertThat(secondGc.id()).isNotEqualTo(firstGc.id());
  }

  @Test
  void coversEveryCompetencyWithRubricQuestions() {
    ScriptedProvider provider = new ScriptedProvider("p", perCompetency());

    QuestionSet set = generator(provider).generate(job, framework);

    assertThat(set.partialCoverage()).isFalse();
    assertThat(set.jobContextId()).isEqualTo(job.id());
    assertThat(set.frameworkId()).isEqualTo(framework.id());
    assertThat(set.metadata().promptVersion()).isEqualTo("question-set@v1");
    assertThat(set.questions()).hasSize(2);
    assertThat(set.questions())
        .flatExtracting(Question::competencyIds)
        .containsExactlyInAnyOrder("java", "communication");
    Question first = set.questions().get(0);
    assertThat(first.rubric().expectedAnswerComponents()).containsExactly("a concrete example");
    assertThat(first.rubric().scoringAnchors())
        .extracting(ScoringAnchor::band)
        .containsExactly("strong");
    assertThat(first.followUpQuestions()).containsExactly("What would you change?");
    assertThat(provider.calls()).isEqualTo(2);
  }

  @Test
  void questionsPerCompetencyAreCapped() {
    properties.setMaxPerCompetency(2);
    ScriptedProvider provider =
        new ScriptedProvider(
            "p",
            prompt -> {
              String id = competencyOf(prompt);
              return questions(
                  item(id + " alpha question about queues", id),
                  item(id + " beta question about caches", id),
                  item(id + " gamma question about locks", id),
                  item(id + " delta question about indexes", id));
            });

    QuestionSet set = generator(provider).generate(job, framework);

    assertThat(set.questions()).hasSize(4);
    assertThat(provider.prompts().get(0)).contains("Write up to 2 questions");
  }

  @Test
  void uncoveredCompetencyTriggersCorrectiveRequest() {
    ScriptedProvider provider =
        new ScriptedProvider(
            "p",
            prompt -> {
              if (prompt.contains(COVERAGE_MARKER)) {
                return questions(item(FEEDBACK_QUESTION, "unknown"));
              }
              return questions(item(GC_QUESTION, "java"));
            });

    QuestionSet set = generator(provider).generate(job, framework);

    assertThat(set.partialCoverage()).isFalse();
    assertThat(set.questions()).hasSize(2);
    Question corrective = set.questions().get(1);
    assertThat(corrective.competencyIds()).containsExactly("communication");
    String coveragePrompt =
        provider.prompts().stream()
            .filter(p -> p.contains(COVERAGE_MARKER))
            .findFirst()
            .orElseThrow();
    assertThat(coveragePrompt)
        .contains("- id: communication")
        .contains(GC_QUESTION);
  }

  @Test
  void persistentGapIsReportedWithPartialSet() {
    ScriptedProvider provider =
        new ScriptedProvider(
            "p",
            prompt ->
                prompt.contains(COVERAGE_MARKER)
                    ? questions()
                    : questions(item(GC_QUESTION, "java")));

    assertThatThrownBy(() -> generator(provider).generate(job, framework))
        .isInstanceOfSatisfying(
            CoverageException.class,
            e -> {
              assertThat(e.partialSet().uncoveredCompetencyIds()).containsExactly("communication");
              assertThat(e.partialSet().partialCoverage()).isTrue();
              assertThat(e.partialSet().questions()).hasSize(1);
            });
  }

  @Test
  void sharedQuestionIsMergedAcrossCompetencies() {
    ScriptedProvider provider =
        ScriptedProvider.replying(
            "p", questions(item("Describe a production incident you led to resolution.", "java")));

    QuestionSet set = generator(provider).generate(job, framework);

    assertThat(set.partialCoverage()).isFalse();
    assertThat(set.questions())
        .singleElement()
        .satisfies(q -> assertThat(q.competencyIds()).containsExactly("java", "communication"));
  }

  @Test
  void modelReferencesByNameAreResolvedToIds() {
    ScriptedProvider provider =
        new ScriptedProvider(
            "p",
            prompt ->
                questions(
                    item(
                        "How do you keep a code review constructive while being precise?",
                        "Java",
                        "Communication")));

    QuestionSet set = generator(provider).generate(job, framework);

    assertThat(set.questions())
        .singleElement()
        .satisfies(q -> assertThat(q.competencyIds()).containsExactly("java", "communication"));
  }

  @Test
  void providerOutageWithoutAnyQuestionPropagates() {
    ScriptedProvider provider =
        ScriptedProvider.failing(
            "p", ProviderException.of(ProviderErrorKind.REJECTED, "p", "invalid api key", null));

    assertThatThrownBy(() -> generator(provider).generate(job, framework))
        .isInstanceOf(ProviderException.class);
  }
}
