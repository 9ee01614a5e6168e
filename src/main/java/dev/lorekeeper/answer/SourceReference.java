package dev.lorekeeper.answer;

import dev.lorekeeper.search.ScoredChunk;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * A retrieved excerpt cited alongside an answer.
 *
 * @param chunkId chunk identifier
 * @param resourceId owning resource
 * @param filename original filename of the resource
 * @param pageNumber page the excerpt starts on, if known
 * @param sectionHeading heading of the excerpt's section, if any
 * @param contentPreview leading characters of the excerpt
 * @param score retrieval score
 * @param rank 1-based position in the retrieved list
 */
public record SourceReference(
    UUID chunkId,
    UUID resourceId,
    String filename,
    @Nullable Integer pageNumber,
    @Nullable String sectionHeading,
    String contentPreview,
    double score,
    int rank) {

  static SourceReference from(ScoredChunk chunk, int rank, int previewLength) {
    String content = chunk.content();
    String preview =
        content.length() <= previewLength ? content : content.substring(0, previewLength);
    return new SourceReference(
        chunk.chunkId(),
        chunk.resourceId(),
        chunk.filename(),
        chunk.pageNumber(),
        chunk.sectionHeading(),
        preview,
        chunk.score(),
        rank);
  }
}
