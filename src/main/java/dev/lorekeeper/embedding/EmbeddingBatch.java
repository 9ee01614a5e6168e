package dev.lorekeeper.embedding;

import java.util.List;

/**
 * Provider response for one request. The order of {@code embeddings} is not guaranteed.
 *
 * @param embeddings one entry per input, tagged with its input index
 * @param totalTokens token usage reported by the provider
 */
public record EmbeddingBatch(List<IndexedEmbedding> embeddings, int totalTokens) {}
