package dev.lorekeeper.document;

import dev.langchain4j.data.embedding.Embedding;
import java.util.UUID;

/**
 * An embedding ready to be written against its chunk.
 *
 * @param chunkId the chunk to update
 * @param embedding the vector
 */
public record ChunkVector(UUID chunkId, Embedding embedding) {}
