package dev.candor.provider;

import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts any LangChain4j {@link ChatModel} (OpenAI, Anthropic, ...) to the {@link
 * CompletionProvider} contract.
 *
 * <p>The model hint is forwarded only when it names one of the models this provider is configured
 * to serve; otherwise the provider's default model answers.
 */
public class LangChain4jCompletionProvider implements CompletionProvider {

  private static final Logger log = LoggerFactory.getLogger(LangChain4jCompletionProvider.class);

  private final String name;
  private final ChatModel chatModel;
  private final String defaultModel;
  private final Set<String> supportedModels;

  public LangChain4jCompletionProvider(
      String name, ChatModel chatModel, String defaultModel, Set<String> supportedModels) {
    this.name = name;
    this.chatModel = chatModel;
    this.defaultModel = defaultModel;
    this.supportedModels = Set.copyOf(supportedModels);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public ProviderResponse complete(
      String prompt, @Nullable String modelHint, CompletionConfig config) {
    ChatRequest.Builder builder =
        ChatRequest.builder()
            .messages(UserMessage.from(prompt))
            .temperature(config.temperature())
            .maxOutputTokens(config.maxOutputTokens());

    String model = defaultModel;
    if (modelHint != null && supportedModels.contains(modelHint)) {
      builder.modelName(modelHint);
      model = modelHint;
    } else if (modelHint != null) {
      log.debug("Provider {} does not serve model hint '{}', using {}", name, modelHint, model);
    }

    ChatResponse response = chatModel.chat(builder.build());
    TokenUsage usage = response.tokenUsage();
    return new ProviderResponse(
        response.aiMessage().text(),
        model,
        usage == null ? 0 : nullToZero(usage.inputTokenCount()),
        usage == null ? 0 : nullToZero(usage.outputTokenCount()));
  }

  private static int nullToZero(@Nullable Integer value) {
    return value == null ? 0 : value;
  }
}
