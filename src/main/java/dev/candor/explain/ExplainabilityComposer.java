package dev.candor.explain;

import dev.candor.evaluation.CompositeScore;
import dev.candor.evaluation.ContributingSpan;
import dev.candor.evaluation.DimensionScore;
import dev.candor.evaluation.SpanPolarity;
import dev.candor.scoring.PercentileResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Builds the explanation of a composite score: highlights ordered by absolute contribution, a
 * narrative naming the decisive factors first, and a confidence flag.
 *
 * <p>Confidence is {@link ConfidenceFlag#LOW} when any dimension's confidence is below the
 * threshold or any percentile came from a pool below the minimum size.
 */
@Component
public class ExplainabilityComposer {

  private final ExplainProperties properties;

  public ExplainabilityComposer(ExplainProperties properties) {
    this.properties = properties;
  }

  public ExplanationArtifact compose(CompositeScore composite, List<PercentileResult> percentiles) {
    List<DimensionHighlight> highlights = new ArrayList<>();
    for (DimensionScore dimension : composite.dimensions()) {
      highlights.add(
          new DimensionHighlight(
              dimension.competencyId(),
              composite.contribution(dimension),
              dimension.rawScore(),
              dimension.confidence(),
              dimension.justification(),
              spans(dimension, SpanPolarity.POSITIVE),
              spans(dimension, SpanPolarity.NEGATIVE)));
    }
    highlights.sort(
        Comparator.comparingDouble((DimensionHighlight h) -> Math.abs(h.contribution()))
            .reversed()
            .thenComparing(DimensionHighlight::competencyId));

    List<String> reasons = new ArrayList<>();
    for (DimensionScore dimension : composite.dimensions()) {
      if (dimension.confidence() < properties.getLowConfidenceThreshold()) {
        reasons.add(
            String.format(
                Locale.ROOT,
                "evaluator confidence for %s is %.2f",
                dimension.competencyId(),
                dimension.confidence()));
      }
    }
    for (PercentileResult percentile : percentiles) {
      if (percentile.provisional()) {
        reasons.add(
            "percentile for "
                + percentile.competencyId()
                + " is provisional (pool of "
                + percentile.poolSizeAtComputation()
                + ")");
      }
    }
    ConfidenceFlag confidence = reasons.isEmpty() ? ConfidenceFlag.HIGH : ConfidenceFlag.LOW;

    return new ExplanationArtifact(
        composite.answerId(),
        narrative(composite, highlights, percentiles),
        highlights,
        confidence,
        reasons);
  }

  private List<String> spans(DimensionScore dimension, SpanPolarity polarity) {
    return dimension.contributingSpans().stream()
        .filter(span -> span.polarity() == polarity)
        .map(ContributingSpan::text)
        .limit(properties.getMaxSpans())
        .toList();
  }

  private static String narrative(
      CompositeScore composite,
      List<DimensionHighlight> highlights,
      List<PercentileResult> percentiles) {
    StringBuilder text = new StringBuilder();
    text.append(String.format(Locale.ROOT, "Composite score %.2f.", composite.raw()));
    if (!highlights.isEmpty()) {
      DimensionHighlight top = highlights.get(0);
      text.append(
          String.format(
              Locale.ROOT,
              " The decisive factor was %s (score %.2f, contribution %.2f)",
              top.competencyId(),
              top.rawScore(),
              top.contribution()));
      if (!top.justification().isBlank()) {
        text.append(": ").append(top.justification());
      }
      text.append('.');
      for (DimensionHighlight other : highlights.subList(1, highlights.size())) {
        text.append(
            String.format(
                Locale.ROOT,
                " %s scored %.2f (contribution %.2f).",
                other.competencyId(),
                other.rawScore(),
                other.contribution()));
      }
    }
    if (composite.partial()) {
      text.append(" Not evaluated: ")
          .append(String.join(", ", composite.failedCompetencyIds()))
          .append("; their weight was redistributed over the evaluated dimensions.");
    }
    List<String> provisional =
        percentiles.stream()
            .filter(PercentileResult::provisional)
            .map(PercentileResult::competencyId)
            .toList();
    if (!provisional.isEmpty()) {
      text.append(" Percentiles for ")
          .append(String.join(", ", provisional))
          .append(" are provisional because too few comparable answers exist yet.");
    }
    return text.toString();
  }
}
