package dev.candor.explain;

import java.util.List;

/**
 * Human-readable explanation of a composite score.
 *
 * @param answerId explained answer
 * @param narrative prose summary, decisive factors first
 * @param highlights dimensions ordered by absolute contribution, largest first
 * @param confidence overall confidence flag
 * @param lowConfidenceReasons why the flag is {@link ConfidenceFlag#LOW}; empty when high
 */
public record ExplanationArtifact(
    String answerId,
    String narrative,
    List<DimensionHighlight> highlights,
    ConfidenceFlag confidence,
    List<String> lowConfidenceReasons) {

  public ExplanationArtifact {
    highlights = List.copyOf(highlights);
    lowConfidenceReasons = List.copyOf(lowConfidenceReasons);
  }
}
