package dev.lorekeeper.answer;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Completion provider settings bound from {@code lorekeeper.completion.*}.
 *
 * @param baseUrl provider API base URL
 * @param apiKey bearer token for the provider
 * @param model chat model name
 * @param temperature sampling temperature
 * @param maxTokens upper bound on generated tokens per answer
 * @param timeoutSeconds request timeout, covering the whole streamed response
 */
@ConfigurationProperties(prefix = "lorekeeper.completion")
public record CompletionProperties(
    String baseUrl,
    String apiKey,
    String model,
    double temperature,
    int maxTokens,
    int timeoutSeconds) {}
