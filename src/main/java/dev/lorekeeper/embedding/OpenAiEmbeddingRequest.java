package dev.lorekeeper.embedding;

import java.util.List;

/** Request body of the OpenAI {@code /embeddings} endpoint. */
public record OpenAiEmbeddingRequest(String model, List<String> input, int dimensions) {}
