package dev.lorekeeper.embedding;

import dev.langchain4j.data.embedding.Embedding;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link EmbeddingProvider} calling the OpenAI embeddings REST API.
 *
 * <p>HTTP 429 is reported as {@link ProviderRateLimitedException} so the caller can back off; every
 * other failure becomes a plain {@link EmbeddingProviderException}.
 */
@Component
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

  private static final int TOO_MANY_REQUESTS = 429;

  private final RestClient restClient;
  private final EmbeddingProperties properties;

  public OpenAiEmbeddingProvider(
      @Qualifier("embeddingRestClient") RestClient restClient, EmbeddingProperties properties) {
    this.restClient = restClient;
    this.properties = properties;
  }

  @Override
  public EmbeddingBatch embed(List<String> inputs) {
    OpenAiEmbeddingResponse response;
    try {
      response =
          restClient
              .post()
              .uri("/embeddings")
              .body(new OpenAiEmbeddingRequest(properties.model(), inputs, properties.dimensions()))
              .retrieve()
              .body(OpenAiEmbeddingResponse.class);
    } catch (HttpStatusCodeException e) {
      if (e.getStatusCode().value() == TOO_MANY_REQUESTS) {
        throw new ProviderRateLimitedException("Embedding provider rate limit reached", e);
      }
      throw new EmbeddingProviderException(
          "Embedding provider returned HTTP "
              + e.getStatusCode().value()
              + ": "
              + e.getResponseBodyAsString(),
          e);
    } catch (RestClientException e) {
      throw new EmbeddingProviderException("Embedding request failed: " + e.getMessage(), e);
    }

    if (response == null || response.data() == null) {
      throw new EmbeddingProviderException("Embedding provider returned an empty response");
    }
    List<IndexedEmbedding> embeddings =
        response.data().stream()
            .map(item -> new IndexedEmbedding(item.index(), Embedding.from(item.embedding())))
            .toList();
    int totalTokens = response.usage() != null ? response.usage().totalTokens() : 0;
    return new EmbeddingBatch(embeddings, totalTokens);
  }

  @Override
  public String modelName() {
    return properties.model();
  }
}
