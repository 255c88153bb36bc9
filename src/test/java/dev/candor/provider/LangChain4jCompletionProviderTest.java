package dev.candor.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jCompletionProviderTest {

  @Mock ChatModel chatModel;

  @Captor ArgumentCaptor<ChatRequest> requestCaptor;

  private final CompletionConfig config =
      new CompletionConfig(0.3, 512, List.of(), Duration.ofSeconds(5), 0);

  private LangChain4jCompletionProvider provider;

  @BeforeEach
  void setUp() {
    provider =
        new LangChain4jCompletionProvider("openai", chatModel, "gpt-4o-mini", Set.of("gpt-4o"));
  }

  private static ChatResponse response(String text, TokenUsage usage) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).tokenUsage(usage).build();
  }

  @Test
  void forwardsGenerationSettingsAndReportsUsage() {
    given(chatModel.chat(any(ChatRequest.class))).willReturn(response("answer", new TokenUsage(12, 34)));

    ProviderResponse result = provider.complete("hello", null, config);

    verify(chatModel).chat(requestCaptor.capture());
    ChatRequest request = requestCaptor.getValue();
    assertThat(request.temperature()).isEqualTo(0.3);
    assertThat(request.maxOutputTokens()).isEqualTo(512);
    assertThat(result.text()).isEqualTo("answer");
    assertThat(result.model()).isEqualTo("gpt-4o-mini");
    assertThat(result.inputTokens()).isEqualTo(12);
    assertThat(result.outputTokens()).isEqualTo(34);
  }

  @Test
  void supportedModelHintIsForwarded() {
    given(chatModel.chat(any(ChatRequest.class))).willReturn(response("x", new TokenUsage(1, 1)));

    ProviderResponse result = provider.complete("hello", "gpt-4o", config);

    verify(chatModel).chat(requestCaptor.capture());
    assertThat(requestCaptor.getValue().modelName()).isEqualTo("gpt-4o");
    assertThat(result.model()).isEqualTo("gpt-4o");
  }

  @Test
  void unsupportedModelHintFallsBackToDefault() {
    given(chatModel.chat(any(ChatRequest.class))).willReturn(response("x", new TokenUsage(1, 1)));

    ProviderResponse result = provider.complete("hello", "claude-opus", config);

    verify(chatModel).chat(requestCaptor.capture());
    assertThat(requestCaptor.getValue().modelName()).isNull();
    assertThat(result.model()).isEqualTo("gpt-4o-mini");
  }
}
