package dev.lorekeeper.api;

import dev.lorekeeper.answer.AnswerRequest;
import dev.lorekeeper.answer.ConversationMessage;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** JSON body of the query and streaming query endpoints. */
public record QueryRequestBody(
    @NotBlank @Size(min = 10, max = 500) String query,
    @Nullable @Min(1) @Max(20) Integer topK,
    @Nullable List<UUID> resourceIds,
    @Nullable UUID conversationId,
    @Nullable @Size(max = 50) List<ConversationMessage> history) {

  AnswerRequest toAnswerRequest(UUID collectionId) {
    return new AnswerRequest(collectionId, query, topK, resourceIds, conversationId, history);
  }
}
