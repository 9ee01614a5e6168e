package dev.lorekeeper.search;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pure static utility fusing the vector and keyword result lists with reciprocal-rank fusion.
 *
 * <p>Each chunk scores {@code sum(1 / (k + rank))} over the lists it appears in, with 1-based
 * ranks; a list a chunk is missing from contributes nothing. A chunk found by both lists is tagged
 * {@link MatchSource#HYBRID}.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
public final class ReciprocalRankFusion {

  private ReciprocalRankFusion() {}

  /**
   * Fuses two ranked lists.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>Walk the vector list, scoring each chunk {@code 1 / (k + rank)}
   *   <li>Walk the keyword list, adding {@code 1 / (k + rank)} to chunks already seen and
   *       inserting new ones
   *   <li>Sort by fused score descending (ties keep first-seen order) and keep {@code limit}
   * </ol>
   *
   * @param vectorResults chunks ordered by vector similarity, best first
   * @param keywordResults chunks ordered by text rank, best first
   * @param k the fusion constant
   * @param limit maximum number of results to return
   * @return fused results, best first, with the fused score and provenance set
   */
  public static List<ScoredChunk> fuse(
      List<ScoredChunk> vectorResults, List<ScoredChunk> keywordResults, int k, int limit) {
    if (vectorResults.isEmpty() && keywordResults.isEmpty()) {
      return List.of();
    }

    Map<UUID, ScoredChunk> fused = new LinkedHashMap<>();
    for (int i = 0; i < vectorResults.size(); i++) {
      ScoredChunk chunk = vectorResults.get(i);
      fused.putIfAbsent(
          chunk.chunkId(), chunk.withScore(contribution(k, i + 1), MatchSource.VECTOR));
    }
    for (int i = 0; i < keywordResults.size(); i++) {
      ScoredChunk chunk = keywordResults.get(i);
      double contribution = contribution(k, i + 1);
      ScoredChunk existing = fused.get(chunk.chunkId());
      if (existing == null) {
        fused.put(chunk.chunkId(), chunk.withScore(contribution, MatchSource.KEYWORD));
      } else if (existing.source() == MatchSource.VECTOR) {
        fused.put(
            chunk.chunkId(),
            existing.withScore(existing.score() + contribution, MatchSource.HYBRID));
      }
    }

    return fused.values().stream()
        .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
        .limit(limit)
        .toList();
  }

  static double contribution(int k, int rank) {
    return 1.0 / (k + rank);
  }
}
