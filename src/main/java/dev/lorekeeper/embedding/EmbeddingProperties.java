package dev.lorekeeper.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Embedding provider settings bound from {@code lorekeeper.embedding.*}.
 *
 * @param baseUrl provider API base URL
 * @param apiKey bearer token for the provider
 * @param model embedding model name
 * @param dimensions vector dimension; must match the database column
 * @param batchSize maximum inputs per provider call
 * @param retry backoff applied to rate-limited calls
 * @param costPerMillionTokens dollar rate used for cost estimates
 * @param connectTimeoutMs TCP connect timeout
 * @param readTimeoutMs response read timeout
 */
@ConfigurationProperties(prefix = "lorekeeper.embedding")
public record EmbeddingProperties(
    String baseUrl,
    String apiKey,
    String model,
    int dimensions,
    int batchSize,
    Retry retry,
    double costPerMillionTokens,
    int connectTimeoutMs,
    int readTimeoutMs) {

  /**
   * @param maxRetries retries after the first attempt
   * @param initialBackoffMs wait before the first retry
   * @param multiplier growth factor between waits
   * @param maxBackoffMs upper bound for a single wait
   */
  public record Retry(
      int maxRetries, long initialBackoffMs, double multiplier, long maxBackoffMs) {}
}
