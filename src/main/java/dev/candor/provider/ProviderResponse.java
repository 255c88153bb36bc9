package dev.candor.provider;

/**
 * Raw output of a single provider call, before gateway normalization.
 *
 * @param text the generated text
 * @param model the model that produced it
 * @param inputTokens prompt tokens consumed (0 when the provider does not report usage)
 * @param outputTokens completion tokens produced (0 when the provider does not report usage)
 */
public record ProviderResponse(String text, String model, int inputTokens, int outputTokens) {

  public ProviderResponse {
    text = text == null ? "" : text;
  }
}
