package com.flamingo.ai.chartreader.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the vision-capable chat model used for chart extraction.
 *
 * <p>The model name configured here is only a default; every extraction request names the model it
 * wants so operators can switch models at runtime through the worker settings.
 *
 * <p>Extraction calls end only on completion or on an explicit cancel, so the HTTP timeout is
 * unbounded unless {@code timeout-seconds} is set to a positive value.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4.1-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:16384}")
  private int maxCompletionTokens;

  /** Stands in for "no timeout"; the HTTP client needs a finite duration. */
  static final Duration UNBOUNDED_TIMEOUT = Duration.ofDays(7);

  @Value("${langchain4j.openai.chat-model.timeout-seconds:0}")
  private long timeoutSeconds;

  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .temperature(0.0)
        .timeout(requestTimeout(timeoutSeconds))
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  static Duration requestTimeout(long seconds) {
    return seconds > 0 ? Duration.ofSeconds(seconds) : UNBOUNDED_TIMEOUT;
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
