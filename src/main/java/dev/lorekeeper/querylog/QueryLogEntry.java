package dev.lorekeeper.querylog;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Everything recorded about a completed query. Chunk ids and scores are aligned by position.
 *
 * @param collectionId collection the question was asked against
 * @param queryText the question
 * @param chunkIds retrieved chunk ids in rank order
 * @param chunkScores score of each retrieved chunk
 * @param answer the generated answer text
 * @param model completion model name
 * @param promptTokens provider-reported prompt tokens
 * @param completionTokens provider-reported completion tokens
 * @param latencyMs end-to-end latency
 * @param conversationId conversation the query belongs to, if any
 */
public record QueryLogEntry(
    UUID collectionId,
    String queryText,
    List<UUID> chunkIds,
    List<Double> chunkScores,
    String answer,
    String model,
    int promptTokens,
    int completionTokens,
    long latencyMs,
    @Nullable UUID conversationId) {

  public QueryLogEntry {
    if (chunkIds.size() != chunkScores.size()) {
      throw new IllegalArgumentException(
          "chunkIds and chunkScores must be aligned: "
              + chunkIds.size()
              + " ids, "
              + chunkScores.size()
              + " scores");
    }
    chunkIds = List.copyOf(chunkIds);
    chunkScores = List.copyOf(chunkScores);
  }
}
