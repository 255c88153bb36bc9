package dev.candor.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Normalized gateway response. Identical in shape whichever provider produced it.
 *
 * @param text the generated text
 * @param structured the parsed JSON object for structured requests, null otherwise
 * @param provider name of the provider that answered
 * @param model model that answered
 * @param usage token usage of the successful call
 * @param latency wall time of the successful call
 * @param attempts calls made to the answering provider, including retries
 */
public record CompletionResult(
    String text,
    @Nullable JsonNode structured,
    String provider,
    String model,
    Usage usage,
    Duration latency,
    int attempts) {

  /** Token usage as reported by the provider. */
  public record Usage(int inputTokens, int outputTokens) {

    public int totalTokens() {
      return inputTokens + outputTokens;
    }
  }
}
