package dev.lorekeeper.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import dev.lorekeeper.BaseIntegrationTest;
import dev.lorekeeper.document.ChunkEmbeddingStore;
import dev.lorekeeper.document.ChunkVector;
import dev.lorekeeper.document.ResourceChunk;
import dev.lorekeeper.document.ResourceChunkRepository;
import dev.lorekeeper.embedding.EmbeddingBatch;
import dev.lorekeeper.embedding.IndexedEmbedding;
import dev.lorekeeper.querylog.QueryLog;
import dev.lorekeeper.querylog.QueryLogRepository;
import dev.lorekeeper.resource.Resource;
import dev.lorekeeper.resource.ResourceRepository;
import dev.lorekeeper.resource.ResourceStatus;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/** End-to-end question answering against a real database with mocked model providers. */
class AnswerServiceIT extends BaseIntegrationTest {

  private static final String QUESTION = "How does grappling work in combat?";

  @Autowired AnswerService answerService;

  @Autowired QueryLogRepository queryLogRepository;

  @Autowired ResourceRepository resourceRepository;

  @Autowired ResourceChunkRepository chunkRepository;

  @Autowired ChunkEmbeddingStore embeddingStore;

  final UUID collection = UUID.randomUUID();

  UUID chunkId;

  @BeforeEach
  void seedTestData() {
    Resource handbook = new Resource(collection, "players-handbook.pdf", "c/handbook.pdf");
    handbook.setStatus(ResourceStatus.COMPLETED);
    handbook = resourceRepository.saveAndFlush(handbook);
    ResourceChunk chunk =
        new ResourceChunk(
            handbook.getId(),
            0,
            195,
            "Grappling: when you want to grab a creature, make an Athletics check.",
            14,
            "Grappling",
            Map.of());
    chunkId = chunkRepository.saveAndFlush(chunk).getId();
    embeddingStore.writeBatch(List.of(new ChunkVector(chunkId, Embedding.from(axis(0)))));

    when(embeddingProvider.embed(any()))
        .thenReturn(
            new EmbeddingBatch(List.of(new IndexedEmbedding(0, Embedding.from(axis(0)))), 7));
  }

  private static ChatResponse completion(String text) {
    return ChatResponse.builder()
        .aiMessage(AiMessage.from(text))
        .tokenUsage(new TokenUsage(850, 120))
        .modelName("gpt-4o-mini-2024-07-18")
        .build();
  }

  @Test
  void answeredQueryIsLoggedBeforeItIsReturned() {
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(completion("Make an Athletics check [Source 1]."));

    AnswerResponse response = answerService.query(AnswerRequest.of(collection, QUESTION));

    assertThat(response.sources())
        .extracting(SourceReference::chunkId)
        .containsExactly(chunkId);
    QueryLog logged = queryLogRepository.findById(response.queryId()).orElseThrow();
    assertThat(logged.getCollectionId()).isEqualTo(collection);
    assertThat(logged.getAnswer()).isEqualTo("Make an Athletics check [Source 1].");
    assertThat(logged.getRetrievedChunkIds()).containsExactly(chunkId);
    assertThat(logged.getModel()).isEqualTo("gpt-4o-mini-2024-07-18");
    assertThat(logged.getConversationId()).isEqualTo(response.metadata().conversationId());
  }

  @Test
  void questionWithNoMatchingChunksIsAnsweredWithoutModelOrLog() {
    AnswerResponse response =
        answerService.query(AnswerRequest.of(UUID.randomUUID(), QUESTION));

    assertThat(response.answer()).isEqualTo(AnswerService.NO_INFORMATION_ANSWER);
    assertThat(response.sources()).isEmpty();
    assertThat(queryLogRepository.count()).isZero();
    verifyNoInteractions(chatModel);
  }

  @Test
  void streamedAnswerIsLoggedOnceComplete() throws Exception {
    doAnswer(
            invocation -> {
              StreamingChatResponseHandler handler = invocation.getArgument(1);
              handler.onPartialResponse("Make an Athletics ");
              handler.onPartialResponse("check [Source 1].");
              handler.onCompleteResponse(completion("Make an Athletics check [Source 1]."));
              return null;
            })
        .when(streamingChatModel)
        .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

    AnswerStream stream = answerService.streamQuery(AnswerRequest.of(collection, QUESTION));
    AnswerResponse response = stream.completion().get(10, TimeUnit.SECONDS);

    assertThat(stream.poll(Duration.ofSeconds(1)))
        .isEqualTo(new StreamEvent.Chunk("Make an Athletics "));
    assertThat(queryLogRepository.findById(response.queryId()))
        .hasValueSatisfying(
            logged -> assertThat(logged.getAnswer()).isEqualTo(response.answer()));
  }
}
