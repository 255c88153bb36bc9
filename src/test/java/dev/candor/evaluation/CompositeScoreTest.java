package dev.candor.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositeScoreTest {

  private static DimensionScore score(String competencyId, double raw) {
    return new DimensionScore("a-1", competencyId, "r-1", raw, 0.9, "ok", List.of());
  }

  @Test
  void compositeIsWeightedMeanOfDimensions() {
    CompositeScore composite =
        CompositeScore.aggregate(
            "a-1",
            "q-1",
            Map.of("java", 0.6, "communication", 0.4),
            List.of(score("java", 0.5), score("communication", 1.0)),
            List.of());

    assertThat(composite.raw()).isCloseTo(0.7, offset(1e-9));
    assertThat(composite.partial()).isFalse();
    assertThat(composite.effectiveWeights()).containsEntry("java", 0.6);
  }

  @Test
  void failedDimensionWeightIsRedistributedProportionally() {
    CompositeScore composite =
        CompositeScore.aggregate(
            "a-1",
            "q-1",
            Map.of("java", 0.2, "sql", 0.2, "communication", 0.6),
            List.of(score("java", 1.0), score("sql", 0.0)),
            List.of("communication"));

    assertThat(composite.partial()).isTrue();
    assertThat(composite.failedCompetencyIds()).containsExactly("communication");
    assertThat(composite.effectiveWeights().get("java")).isCloseTo(0.5, offset(1e-9));
    assertThat(composite.effectiveWeights().get("sql")).isCloseTo(0.5, offset(1e-9));
    assertThat(composite.raw()).isCloseTo(0.5, offset(1e-9));
  }

  @Test
  void zeroWeightSuccessesShareEqually() {
    CompositeScore composite =
        CompositeScore.aggregate(
            "a-1",
            "q-1",
            Map.of("java", 0.0, "sql", 0.0, "communication", 1.0),
            List.of(score("java", 0.2), score("sql", 0.6)),
            List.of("communication"));

    assertThat(composite.raw()).isCloseTo(0.4, offset(1e-9));
  }

  @Test
  void contributionIsEffectiveWeightTimesScore() {
    DimensionScore java = score("java", 0.5);
    CompositeScore composite =
        CompositeScore.aggregate(
            "a-1",
            "q-1",
            Map.of("java", 0.75, "communication", 0.25),
            List.of(java, score("communication", 1.0)),
            List.of());

    assertThat(composite.contribution(java)).isCloseTo(0.375, offset(1e-9));
  }

  @Test
  void atLeastOneSuccessIsRequired() {
    assertThatThrownBy(
            () ->
                CompositeScore.aggregate(
                    "a-1", "q-1", Map.of("java", 1.0), List.of(), List.of("java")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
