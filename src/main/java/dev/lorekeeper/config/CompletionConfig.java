package dev.lorekeeper.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.lorekeeper.answer.CompletionProperties;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the LangChain4j chat models used for answer generation.
 *
 * <p>Both models share {@code lorekeeper.completion.*}, so blocking and streamed answers are
 * produced by the same model with the same sampling parameters.
 */
@Configuration
public class CompletionConfig {

  @Bean
  public ChatModel chatModel(CompletionProperties properties) {
    return OpenAiChatModel.builder()
        .baseUrl(properties.baseUrl())
        .apiKey(properties.apiKey())
        .modelName(properties.model())
        .temperature(properties.temperature())
        .maxTokens(properties.maxTokens())
        .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
        .build();
  }

  @Bean
  public StreamingChatModel streamingChatModel(CompletionProperties properties) {
    return OpenAiStreamingChatModel.builder()
        .baseUrl(properties.baseUrl())
        .apiKey(properties.apiKey())
        .modelName(properties.model())
        .temperature(properties.temperature())
        .maxTokens(properties.maxTokens())
        .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
        .build();
  }
}
