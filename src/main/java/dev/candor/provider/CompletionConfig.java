package dev.candor.provider;

import java.time.Duration;
import java.util.List;

/**
 * Generation settings for one gateway request.
 *
 * @param temperature sampling temperature in [0, 2]
 * @param maxOutputTokens upper bound on generated tokens (>= 1)
 * @param providerPreferenceOrder provider names to try in order; empty means all registered
 *     providers in registration order
 * @param timeout per-call timeout (positive)
 * @param maxRetries retries per provider for transient failures (>= 0)
 */
public record CompletionConfig(
    double temperature,
    int maxOutputTokens,
    List<String> providerPreferenceOrder,
    Duration timeout,
    int maxRetries) {

  public CompletionConfig {
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalArgumentException("temperature must be in [0, 2], got: " + temperature);
    }
    if (maxOutputTokens < 1) {
      throw new IllegalArgumentException("maxOutputTokens must be >= 1, got: " + maxOutputTokens);
    }
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
    }
    providerPreferenceOrder =
        providerPreferenceOrder == null ? List.of() : List.copyOf(providerPreferenceOrder);
  }

  public CompletionConfig withTemperature(double newTemperature) {
    return new CompletionConfig(
        newTemperature, maxOutputTokens, providerPreferenceOrder, timeout, maxRetries);
  }

  public CompletionConfig withMaxOutputTokens(int newMaxOutputTokens) {
    return new CompletionConfig(
        temperature, newMaxOutputTokens, providerPreferenceOrder, timeout, maxRetries);
  }

  public CompletionConfig withProviderPreferenceOrder(List<String> order) {
    return new CompletionConfig(temperature, maxOutputTokens, order, timeout, maxRetries);
  }
}
