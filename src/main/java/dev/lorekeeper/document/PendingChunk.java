package dev.lorekeeper.document;

import java.util.UUID;

/**
 * A chunk awaiting its embedding.
 *
 * @param id chunk identifier
 * @param chunkIndex position within its resource
 * @param text the chunk text to embed
 */
public record PendingChunk(UUID id, int chunkIndex, String text) {}
