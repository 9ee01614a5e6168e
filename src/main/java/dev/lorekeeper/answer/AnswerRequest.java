package dev.lorekeeper.answer;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * A question asked against one collection.
 *
 * @param collectionId collection whose resources are searched
 * @param query the question
 * @param topK number of excerpts to retrieve, or {@code null} for the configured default
 * @param resourceIds restrict retrieval to these resources; empty means all
 * @param conversationId conversation to attach the query to, or {@code null} to start one
 * @param history earlier messages of the conversation, oldest first
 */
public record AnswerRequest(
    UUID collectionId,
    String query,
    @Nullable Integer topK,
    List<UUID> resourceIds,
    @Nullable UUID conversationId,
    List<ConversationMessage> history) {

  public AnswerRequest {
    if (collectionId == null) {
      throw new IllegalArgumentException("collectionId must not be null");
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    resourceIds = resourceIds == null ? List.of() : List.copyOf(resourceIds);
    history = history == null ? List.of() : List.copyOf(history);
  }

  /** A standalone question with default retrieval settings. */
  public static AnswerRequest of(UUID collectionId, String query) {
    return new AnswerRequest(collectionId, query, null, List.of(), null, List.of());
  }
}
