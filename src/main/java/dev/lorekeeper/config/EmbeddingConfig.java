package dev.lorekeeper.config;

import dev.lorekeeper.embedding.EmbeddingProperties;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to call the embedding provider.
 *
 * <p>Base URL, credentials and timeouts come from {@code lorekeeper.embedding.*}. The client is
 * qualified as {@code "embeddingRestClient"}.
 */
@Configuration
public class EmbeddingConfig {

  /**
   * Creates a pre-configured {@link RestClient} targeting the embedding provider.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties provider URL, key and timeouts
   * @return a named REST client bean for injection into the provider adapter
   */
  @Bean
  public RestClient embeddingRestClient(
      RestClient.Builder builder, EmbeddingProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
        .build();
  }
}
