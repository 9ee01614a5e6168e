package dev.lorekeeper.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Response body of the OpenAI {@code /embeddings} endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenAiEmbeddingResponse(List<Item> data, Usage usage) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Item(int index, float[] embedding) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Usage(
      @JsonProperty("prompt_tokens") int promptTokens,
      @JsonProperty("total_tokens") int totalTokens) {}
}
