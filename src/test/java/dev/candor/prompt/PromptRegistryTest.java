package dev.candor.prompt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.candor.fixture.Prompts;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class PromptRegistryTest {

  private static PromptRegistry.WeightedVersion version(String name, String version, double weight) {
    return new PromptRegistry.WeightedVersion(
        new PromptTemplate(name, version, name + " " + version), weight);
  }

  @Test
  void assignmentIsDeterministicPerSubject() {
    PromptRegistry registry =
        PromptRegistry.of(
            Map.of("question-set", "exp-1"),
            List.of(version("question-set", "v1", 1.0), version("question-set", "v2", 1.0)));

    for (int i = 0; i < 20; i++) {
      VariantSelector selector = VariantSelector.of("job-" + i);
      PromptTemplate first = registry.resolve("question-set", selector);
      PromptTemplate again = registry.resolve("question-set", selector);
      assertThat(again).isEqualTo(first);
    }
  }

  @Test
  void trafficFollowsWeights() {
    PromptRegistry registry =
        PromptRegistry.of(
            Map.of(),
            List.of(version("answer-evaluation", "v1", 3.0), version("answer-evaluation", "v2", 1.0)));

    Map<String, Integer> counts = new HashMap<>();
    IntStream.range(0, 4000)
        .forEach(
            i ->
                counts.merge(
                    registry.resolve("answer-evaluation", VariantSelector.of("cand-" + i)).version(),
                    1,
                    Integer::sum));

    assertThat(counts.get("v1")).isBetween(2800, 3200);
    assertThat(counts.get("v2")).isBetween(800, 1200);
  }

  @Test
  void changingExperimentReshufflesAssignments() {
    List<PromptRegistry.WeightedVersion> versions =
        List.of(version("t", "v1", 1.0), version("t", "v2", 1.0));
    PromptRegistry before = PromptRegistry.of(Map.of("t", "exp-a"), versions);
    PromptRegistry after = PromptRegistry.of(Map.of("t", "exp-b"), versions);

    long moved =
        IntStream.range(0, 200)
            .filter(
                i ->
                    !before
                        .resolve("t", VariantSelector.of("s" + i))
                        .equals(after.resolve("t", VariantSelector.of("s" + i))))
            .count();

    assertThat(moved).isGreaterThan(50);
  }

  @Test
  void exactVersionLookupAndListing() {
    PromptRegistry registry =
        PromptRegistry.of(Map.of(), List.of(version("t", "v1", 1.0), version("t", "v2", 0.5)));

    assertThat(registry.resolve("t", "v2").text()).isEqualTo("t v2");
    assertThat(registry.versions("t")).containsExactly("v1", "v2");
    assertThatThrownBy(() -> registry.resolve("t", "v9"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> registry.resolve("missing", VariantSelector.of("x")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void nonPositiveWeightIsRejected() {
    assertThatThrownBy(() -> version("t", "v1", 0.0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void bundledTemplatesLoadFromClasspath() {
    PromptRegistry registry = Prompts.bundled();

    assertThat(registry.resolve(PromptNames.THOUGHT_CHAIN, "v1").placeholders())
        .containsExactlyInAnyOrder(
            "description", "seniority", "expectation_bar", "domain", "company_size", "culture_tags");
    assertThat(registry.resolve(PromptNames.QUESTION_SET, "v1").placeholders())
        .containsExactlyInAnyOrder(
            "description",
            "seniority",
            "expectation_bar",
            "competency_id",
            "competency_name",
            "competency_category",
            "competency_rationale",
            "competency_catalogue",
            "max_questions");
    assertThat(registry.resolve(PromptNames.QUESTION_COVERAGE, "v1").placeholders())
        .contains("existing_questions", "competency_id");
    assertThat(registry.resolve(PromptNames.ANSWER_EVALUATION, "v1").placeholders())
        .containsExactlyInAnyOrder(
            "question",
            "competency_id",
            "competency_name",
            "competency_category",
            "seniority",
            "rubric",
            "answer");
  }
}
