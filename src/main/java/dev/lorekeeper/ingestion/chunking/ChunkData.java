package dev.lorekeeper.ingestion.chunking;

import org.jspecify.annotations.Nullable;

/**
 * A token-bounded passage produced by {@link DocumentChunker}.
 *
 * @param content the passage text, a verbatim slice of the assembled document text
 * @param tokenCount subword token count used for the size bounds
 * @param pageNumber page on which the passage starts
 * @param sectionHeading heading of the section the passage came from, or null
 * @param startOffset start offset into the assembled document text (inclusive)
 * @param endOffset end offset into the assembled document text (exclusive)
 */
public record ChunkData(
    String content,
    int tokenCount,
    int pageNumber,
    @Nullable String sectionHeading,
    int startOffset,
    int endOffset) {}
