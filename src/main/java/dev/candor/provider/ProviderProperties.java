package dev.candor.provider;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Provider endpoints bound from {@code candor.providers.*}. Each entry becomes one {@link
 * CompletionProvider}; entries without an API key are skipped at startup.
 */
@ConfigurationProperties(prefix = "candor.providers")
public record ProviderProperties(List<Entry> entries) {

  public ProviderProperties {
    entries = entries == null ? List.of() : List.copyOf(entries);
  }

  /** Supported provider families. */
  public enum Type {
    OPEN_AI,
    ANTHROPIC
  }

  public record Entry(
      String name,
      Type type,
      String apiKey,
      String model,
      String baseUrl,
      Set<String> supportedModels,
      Duration timeout) {

    public Entry {
      supportedModels = supportedModels == null ? Set.of() : Set.copyOf(supportedModels);
    }
  }
}
