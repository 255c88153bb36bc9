package dev.candor.question;

import java.time.Instant;

/**
 * @param promptVersion qualified version of the {@code question-set} template used
 * @param generatedAt generation time
 */
public record GenerationMetadata(String promptVersion, Instant generatedAt) {}
