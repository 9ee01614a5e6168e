package dev.lorekeeper.embedding;

import dev.langchain4j.data.embedding.Embedding;

/**
 * One vector returned by the provider, tagged with the position of its input in the request.
 *
 * @param index zero-based position of the input text
 * @param embedding the vector
 */
public record IndexedEmbedding(int index, Embedding embedding) {}
