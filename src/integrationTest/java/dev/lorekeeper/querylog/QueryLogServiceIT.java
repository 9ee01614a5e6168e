package dev.lorekeeper.querylog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.lorekeeper.BaseIntegrationTest;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class QueryLogServiceIT extends BaseIntegrationTest {

  @Autowired QueryLogService queryLogService;

  @Autowired QueryLogRepository repository;

  private static QueryLogEntry entry(UUID conversationId, UUID... chunkIds) {
    List<Double> scores =
        IntStream.range(0, chunkIds.length)
            .mapToObj(i -> 1.0 / (61 + i))
            .toList();
    return new QueryLogEntry(
        UUID.randomUUID(),
        "How does grappling work in combat?",
        List.of(chunkIds),
        scores,
        "Make an Athletics check [Source 1].",
        "gpt-4o-mini-2024-07-18",
        850,
        120,
        1450,
        conversationId);
  }

  @Test
  void loggedQueryRoundtripsAgainstFlywaySchema() {
    UUID conversation = UUID.randomUUID();
    UUID first = UUID.randomUUID();
    UUID second = UUID.randomUUID();

    UUID id = queryLogService.log(entry(conversation, first, second));

    QueryLog found = repository.findById(id).orElseThrow();
    assertThat(found.getQueryText()).isEqualTo("How does grappling work in combat?");
    assertThat(found.getRetrievedChunkIds()).containsExactly(first, second);
    assertThat(found.getRetrievedChunkScores()).containsExactly(1.0 / 61, 1.0 / 62);
    assertThat(found.getModel()).isEqualTo("gpt-4o-mini-2024-07-18");
    assertThat(found.getPromptTokens()).isEqualTo(850);
    assertThat(found.getCompletionTokens()).isEqualTo(120);
    assertThat(found.getLatencyMs()).isEqualTo(1450);
    assertThat(found.getConversationId()).isEqualTo(conversation);
    assertThat(found.getFeedbackRating()).isNull();
    assertThat(found.getCreatedAt()).isNotNull();
  }

  @Test
  void queryWithoutChunksStoresEmptyArrays() {
    UUID id = queryLogService.log(entry(UUID.randomUUID()));

    QueryLog found = repository.findById(id).orElseThrow();
    assertThat(found.getRetrievedChunkIds()).isEmpty();
    assertThat(found.getRetrievedChunkScores()).isEmpty();
  }

  @Test
  void feedbackIsStoredAndReplaced() {
    UUID id = queryLogService.log(entry(UUID.randomUUID(), UUID.randomUUID()));

    queryLogService.recordFeedback(id, 2, "Wrong page");
    queryLogService.recordFeedback(id, 5, null);

    QueryLog found = repository.findById(id).orElseThrow();
    assertThat(found.getFeedbackRating()).isEqualTo(5);
    assertThat(found.getFeedbackComment()).isNull();
    assertThat(found.getFeedbackUpdatedAt()).isNotNull();
  }

  @Test
  void feedbackForUnknownQueryIsRejected() {
    UUID unknown = UUID.randomUUID();

    assertThatThrownBy(() -> queryLogService.recordFeedback(unknown, 4, null))
        .isInstanceOf(QueryLogNotFoundException.class);
  }
}
