package dev.candor.evaluation;

/** An excerpt of the answer that moved a dimension score. */
public record ContributingSpan(String text, SpanPolarity polarity) {}
