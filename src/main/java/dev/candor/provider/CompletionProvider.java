package dev.candor.provider;

import org.jspecify.annotations.Nullable;

/**
 * Capability interface implemented once per external completion provider. Only the gateway talks
 * to providers; implementations may throw anything and the gateway normalizes it.
 */
public interface CompletionProvider {

  /** Unique provider name, referenced by {@link CompletionConfig#providerPreferenceOrder()}. */
  String name();

  /**
   * Performs one blocking completion call.
   *
   * @param prompt fully rendered prompt text
   * @param modelHint preferred model, applied only if this provider serves it
   * @param config generation settings
   * @return the provider's raw response
   */
  ProviderResponse complete(String prompt, @Nullable String modelHint, CompletionConfig config);
}
