package dev.candor.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Builds one {@link CompletionProvider} per configured endpoint and the {@link ProviderGateway} in
 * front of them. LangChain4j's own retries are disabled; the gateway owns retry and failover.
 */
@Configuration
public class ProviderConfig {

  private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);

  static List<CompletionProvider> completionProviders(
      ProviderProperties providerProperties, GatewayProperties gatewayProperties) {
    List<CompletionProvider> providers = new ArrayList<>();
    for (ProviderProperties.Entry entry : providerProperties.entries()) {
      if (entry.apiKey() == null || entry.apiKey().isBlank()) {
        log.warn("Provider {} has no API key configured, skipping", entry.name());
        continue;
      }
      Duration timeout = entry.timeout() != null ? entry.timeout() : gatewayProperties.getTimeout();
      providers.add(
          new LangChain4jCompletionProvider(
              entry.name(), chatModel(entry, timeout), entry.model(), entry.supportedModels()));
      log.info("Registered provider {} ({}, model {})", entry.name(), entry.type(), entry.model());
    }
    return providers;
  }

  @Bean
  public ProviderGateway providerGateway(
      ProviderProperties providerProperties,
      GatewayProperties gatewayProperties,
      ObjectMapper objectMapper,
      @Qualifier("providerExecutor") ExecutorService providerExecutor) {
    return new ProviderGateway(
        completionProviders(providerProperties, gatewayProperties),
        gatewayProperties,
        objectMapper,
        providerExecutor,
        new ThreadWaitSleeper());
  }

  private static ChatModel chatModel(ProviderProperties.Entry entry, Duration timeout) {
    boolean customUrl = entry.baseUrl() != null && !entry.baseUrl().isBlank();
    return switch (entry.type()) {
      case OPEN_AI -> {
        OpenAiChatModel.OpenAiChatModelBuilder builder =
            OpenAiChatModel.builder()
                .apiKey(entry.apiKey())
                .modelName(entry.model())
                .timeout(timeout)
                .maxRetries(0);
        if (customUrl) {
          builder.baseUrl(entry.baseUrl());
        }
        yield builder.build();
      }
      case ANTHROPIC -> {
        AnthropicChatModel.AnthropicChatModelBuilder builder =
            AnthropicChatModel.builder()
                .apiKey(entry.apiKey())
                .modelName(entry.model())
                .timeout(timeout)
                .maxRetries(0);
        if (customUrl) {
          builder.baseUrl(entry.baseUrl());
        }
        yield builder.build();
      }
    };
  }
}
