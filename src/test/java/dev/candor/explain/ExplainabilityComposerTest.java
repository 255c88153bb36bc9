package dev.candor.explain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import dev.candor.evaluation.CompositeScore;
import dev.candor.evaluation.ContributingSpan;
import dev.candor.evaluation.DimensionScore;
import dev.candor.evaluation.SpanPolarity;
import dev.candor.scoring.PercentileResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExplainabilityComposerTest {

  private ExplainProperties properties;
  private ExplainabilityComposer composer;

  @BeforeEach
  void setUp() {
    properties = new ExplainProperties();
    composer = new ExplainabilityComposer(properties);
  }

  private static DimensionScore dimension(
      String competencyId, double raw, double confidence, ContributingSpan... spans) {
    return new DimensionScore(
        "a-1", competencyId, "question-set@v1", raw, confidence, competencyId + " reasoning",
        List.of(spans));
  }

  private static PercentileResult percentile(String competencyId, long pool, boolean provisional) {
    return new PercentileResult("a-1", competencyId, 60.0, pool, false, provisional);
  }

  private static CompositeScore composite(List<DimensionScore> dimensions, List<String> failed) {
    return CompositeScore.aggregate(
        "a-1", "q-1", Map.of("java", 0.6, "communication", 0.4), dimensions, failed);
  }

  @Test
  void highlightsAreOrderedByContribution() {
    CompositeScore composite =
        composite(List.of(dimension("java", 0.2, 0.9), dimension("communication", 0.9, 0.9)), List.of());

    ExplanationArtifact artifact = composer.compose(composite, List.of());

    assertThat(artifact.highlights())
        .extracting(DimensionHighlight::competencyId)
        .containsExactly("communication", "java");
    assertThat(artifact.highlights().get(0).contribution()).isCloseTo(0.36, offset(1e-9));
    assertThat(artifact.highlights().get(1).contribution()).isCloseTo(0.12, offset(1e-9));
    assertThat(artifact.narrative())
        .startsWith("Composite score 0.48.")
        .contains("The decisive factor was communication (score 0.90, contribution 0.36)")
        .contains("communication reasoning")
        .contains("java scored 0.20 (contribution 0.12).");
  }

  @Test
  void confidentFullEvaluationIsFlaggedHigh() {
    CompositeScore composite =
        composite(List.of(dimension("java", 0.8, 0.9), dimension("communication", 0.7, 0.6)), List.of());

    ExplanationArtifact artifact =
        composer.compose(
            composite, List.of(percentile("java", 40, false), percentile("overall", 40, false)));

    assertThat(artifact.confidence()).isEqualTo(ConfidenceFlag.HIGH);
    assertThat(artifact.lowConfidenceReasons()).isEmpty();
    assertThat(artifact.answerId()).isEqualTo("a-1");
  }

  @Test
  void lowEvaluatorConfidenceIsFlagged() {
    CompositeScore composite =
        composite(List.of(dimension("java", 0.8, 0.4), dimension("communication", 0.7, 0.9)), List.of());

    ExplanationArtifact artifact = composer.compose(composite, List.of());

    assertThat(artifact.confidence()).isEqualTo(ConfidenceFlag.LOW);
    assertThat(artifact.lowConfidenceReasons())
        .containsExactly("evaluator confidence for java is 0.40");
  }

  @Test
  void provisionalPercentilesAreFlaggedAndNarrated() {
    CompositeScore composite =
        composite(List.of(dimension("java", 0.8, 0.9), dimension("communication", 0.7, 0.9)), List.of());

    ExplanationArtifact artifact =
        composer.compose(
            composite, List.of(percentile("java", 4, true), percentile("overall", 40, false)));

    assertThat(artifact.confidence()).isEqualTo(ConfidenceFlag.LOW);
    assertThat(artifact.lowConfidenceReasons())
        .containsExactly("percentile for java is provisional (pool of 4)");
    assertThat(artifact.narrative()).contains("Percentiles for java are provisional");
  }

  @Test
  void partialCompositeNamesMissingDimensions() {
    CompositeScore composite = composite(List.of(dimension("java", 0.5, 0.9)), List.of("communication"));

    ExplanationArtifact artifact = composer.compose(composite, List.of());

    assertThat(artifact.highlights()).hasSize(1);
    assertThat(artifact.highlights().get(0).contribution()).isCloseTo(0.5, offset(1e-9));
    assertThat(artifact.narrative()).contains("Not evaluated: communication");
  }

  @Test
  void spansAreSplitByPolarityAndCapped() {
    properties.setMaxSpans(2);
    CompositeScore composite =
        composite(
            List.of(
                dimension(
                    "java",
                    0.7,
                    0.9,
                    new ContributingSpan("uses idempotency keys", SpanPolarity.POSITIVE),
                    new ContributingSpan("ignores retries", SpanPolarity.NEGATIVE),
                    new ContributingSpan("stores request hash", SpanPolarity.POSITIVE),
                    new ContributingSpan("mentions outbox", SpanPolarity.POSITIVE)),
                dimension("communication", 0.7, 0.9)),
            List.of());

    DimensionHighlight java =
        composer.compose(composite, List.of()).highlights().stream()
            .filter(h -> h.competencyId().equals("java"))
            .findFirst()
            .orElseThrow();

    assertThat(java.positiveSpans()).containsExactly("uses idempotency keys", "stores request hash");
    assertThat(java.negativeSpans()).containsExactly("ignores retries");
  }
}
