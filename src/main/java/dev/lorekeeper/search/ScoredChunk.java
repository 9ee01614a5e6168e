package dev.lorekeeper.search;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * A chunk returned by a search, with its score and provenance. Never persisted.
 *
 * @param chunkId chunk identifier
 * @param resourceId owning resource
 * @param content chunk text
 * @param pageNumber page the chunk starts on, if known
 * @param sectionHeading heading of the originating section, if any
 * @param filename original filename of the resource
 * @param score similarity, text rank or fused score depending on the search mode
 * @param source which ranked list(s) produced the result
 */
public record ScoredChunk(
    UUID chunkId,
    UUID resourceId,
    String content,
    @Nullable Integer pageNumber,
    @Nullable String sectionHeading,
    String filename,
    double score,
    MatchSource source) {

  ScoredChunk withScore(double newScore, MatchSource newSource) {
    return new ScoredChunk(
        chunkId, resourceId, content, pageNumber, sectionHeading, filename, newScore, newSource);
  }
}
