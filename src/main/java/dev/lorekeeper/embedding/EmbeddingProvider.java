package dev.lorekeeper.embedding;

import java.util.List;

/** External service turning strings into fixed-dimension vectors. */
public interface EmbeddingProvider {

  /**
   * Embeds a batch of inputs in a single call.
   *
   * @param inputs the texts to embed, at most the configured batch size
   * @return one vector per input, possibly out of order
   * @throws ProviderRateLimitedException when the provider asks the caller to slow down
   * @throws EmbeddingProviderException for any other failure
   */
  EmbeddingBatch embed(List<String> inputs);

  /** Name of the embedding model, recorded with usage. */
  String modelName();
}
