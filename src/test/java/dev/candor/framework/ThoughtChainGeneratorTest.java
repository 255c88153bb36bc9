package dev.candor.framework;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.candor.cache.CacheProperties;
import dev.candor.cache.ResponseCache;
import dev.candor.fixture.FrameworkBuilder;
import dev.candor.fixture.Gateways;
import dev.candor.fixture.InMemorySharedStore;
import dev.candor.fixture.MutableClock;
import dev.candor.fixture.Prompts;
import dev.candor.fixture.ScriptedProvider;
import dev.candor.job.JobContext;
import dev.candor.provider.GatewayProperties;
import dev.candor.provider.ProviderErrorKind;
import dev.candor.provider.ProviderException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ThoughtChainGeneratorTest {

  private static final String BALANCED =
      """
      {"competencies": [
        {"name": "Java", "category": "TECHNICAL", "weight": 0.5, "rationale": "core language"},
        {"name": "Distributed Systems", "category": "technical", "weight": 0.3, "rationale": "payments at scale"},
        {"name": "Communication", "category": "soft skill", "weight": 0.2, "rationale": "works with product"}
      ]}
      """;

  private static final String TECHNICAL_ONLY =
      """
      {"competencies": [
        {"name": "Java", "category": "TECHNICAL", "weight": 1.0, "rationale": "core"}
      ]}
      """;

  private ExecutorService executor;
  private MutableClock clock;
  private ResponseCache cache;
  private final JobContext job = new FrameworkBuilder().job();

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
    clock = MutableClock.atEpochDay();
    cache =
        new ResponseCache(
            new CacheProperties(),
            new InMemorySharedStore(clock),
            new ObjectMapper().findAndRegisterModules(),
            clock);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private ThoughtChainGenerator generator(ScriptedProvider provider) {
    return generator(provider, Gateways.fastProperties());
  }

  private ThoughtChainGenerator generator(ScriptedProvider provider, GatewayProperties properties) {
    return new ThoughtChainGenerator(
        Gateways.gateway(executor, properties, provider),
        Prompts.bundled(),
        cache,
        new ObjectMapper(),
        clock);
  }

  @Test
  void buildsNormalizedFrameworkFromModelOutput() {
    ScriptedProvider provider = ScriptedProvider.replying("p", BALANCED);

    CompetencyFramework framework = generator(provider).generate(job);

    assertThat(framework.jobContextId()).isEqualTo(job.id());
    assertThat(framework.promptVersion()).isEqualTo("thought-chain@v1");
    assertThat(framework.competencies())
        .extracting(Competency::id)
        .containsExactly("java", "distributed-systems", "communication");
    assertThat(framework.competency("distributed-systems").orElseThrow().category())
        .isEqualTo(CompetencyCategory.TECHNICAL);
    assertThat(framework.competency("communication").orElseThrow().category())
        .isEqualTo(CompetencyCategory.SOFT_SKILL);
    assertThat(framework.competencies().stream().mapToDouble(Competency::weight).sum())
        .isCloseTo(1.0, offset(1e-9));
    assertThat(provider.prompts().get(0)).contains(job.description()).contains("SENIOR");
  }

  @Test
  void sameJobIsServedFromCache() {
    ScriptedProvider provider = ScriptedProvider.replying("p", BALANCED);
    ThoughtChainGenerator generator = generator(provider);

    CompetencyFramework first = generator.generate(job);
    CompetencyFramework second = generator.generate(job);

    assertThat(second).isEqualTo(first);
    assertThat(provider.calls()).isEqualTo(1);
  }

  @Test
  void unbalancedFrameworkIsRetriedOnceWithCorrection() {
    AtomicInteger count = new AtomicInteger();
    Function<String, String> behaviour =
        prompt -> count.incrementAndGet() == 1 ? TECHNICAL_ONLY : BALANCED;
    ScriptedProvider provider = new ScriptedProvider("p", behaviour);

    CompetencyFramework framework = generator(provider).generate(job);

    assertThat(framework.competencies()).hasSize(3);
    assertThat(provider.prompts().get(1)).endsWith(ThoughtChainGenerator.CORRECTIVE_INSTRUCTION);
  }

  @Test
  void persistentlyUnbalancedFrameworkIsRejected() {
    ScriptedProvider provider = ScriptedProvider.replying("p", TECHNICAL_ONLY);

    assertThatThrownBy(() -> generator(provider).generate(job))
        .isInstanceOfSatisfying(
            FrameworkValidationException.class,
            e -> assertThat(e.rejectedCompetencies()).extracting(Competency::id).containsExactly("java"));
    assertThat(provider.calls()).isEqualTo(2);
  }

  @Test
  void failedGenerationIsNotCached() {
    AtomicInteger count = new AtomicInteger();
    ScriptedProvider provider =
        new ScriptedProvider(
            "p",
            prompt -> {
              if (count.incrementAndGet() == 1) {
                throw ProviderException.of(ProviderErrorKind.UNAVAILABLE, "p", "503", null);
              }
              return BALANCED;
            });
    GatewayProperties noRetries = Gateways.fastProperties();
    noRetries.setMaxRetries(0);
    ThoughtChainGenerator generator = generator(provider, noRetries);

    assertThatThrownBy(() -> generator.generate(job)).isInstanceOf(ProviderException.class);
    assertThat(generator.generate(job).competencies()).hasSize(3);
  }

  @Test
  void duplicateCompetenciesAreMergedAndWeightsSummed() {
    String duplicated =
        """
        {"competencies": [
          {"name": "Java", "category": "TECHNICAL", "weight": 0.3, "rationale": "language"},
          {"name": "java ", "category": "TECHNICAL", "weight": 0.3, "rationale": "ecosystem"},
          {"name": "Teamwork", "category": "CULTURE_FIT", "weight": 0.4}
        ]}
        """;

    CompetencyFramework framework =
        generator(ScriptedProvider.replying("p", duplicated)).generate(job);

    assertThat(framework.competencies()).hasSize(2);
    Competency java = framework.competency("java").orElseThrow();
    assertThat(java.weight()).isCloseTo(0.6, offset(1e-9));
    assertThat(java.rationale()).contains("language").contains("ecosystem");
  }

  @Test
  void missingWeightsFallBackToUniform() {
    String unweighted =
        """
        {"competencies": [
          {"name": "SQL", "category": "TECHNICAL"},
          {"name": "Ownership", "category": "SOFT_SKILL", "weight": 0.9}
        ]}
        """;

    CompetencyFramework framework =
        generator(ScriptedProvider.replying("p", unweighted)).generate(job);

    assertThat(framework.competencies()).extracting(Competency::weight).containsExactly(0.5, 0.5);
  }
}
