package dev.candor.question;

/**
 * What an answer in one score band looks like.
 *
 * @param band band label, e.g. {@code 0.0-0.3 weak}
 * @param description observable characteristics of answers in the band
 */
public record ScoringAnchor(String band, String description) {}
