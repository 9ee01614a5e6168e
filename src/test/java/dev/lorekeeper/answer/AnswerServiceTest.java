package dev.lorekeeper.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import dev.lorekeeper.querylog.QueryLogEntry;
import dev.lorekeeper.querylog.QueryLogService;
import dev.lorekeeper.querylog.QueryLoggingException;
import dev.lorekeeper.search.HybridSearchService;
import dev.lorekeeper.search.ScoredChunk;
import dev.lorekeeper.search.SearchMode;
import dev.lorekeeper.search.SearchProperties;
import dev.lorekeeper.search.SearchRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class AnswerServiceTest {

  private static final UUID COLLECTION = UUID.randomUUID();
  private static final UUID QUERY_ID = UUID.randomUUID();
  private static final String QUESTION = "How does grappling work in combat?";

  @Mock HybridSearchService searchService;

  @Mock ChatModel chatModel;

  @Mock StreamingChatModel streamingChatModel;

  @Mock QueryLogService queryLogService;

  @Captor ArgumentCaptor<QueryLogEntry> entryCaptor;

  @Captor ArgumentCaptor<SearchRequest> searchCaptor;

  AnswerService answerService;

  private final List<ScoredChunk> chunks =
      List.of(
          PromptBuilderTest.excerpt("Grappling uses an Athletics check.", 195, "Combat"),
          PromptBuilderTest.excerpt("A grappled creature's speed becomes 0.", 290, "Conditions"));

  private final List<Runnable> pending = new ArrayList<>();

  @BeforeEach
  void setUp() {
    answerService = newAnswerService(Runnable::run);
  }

  private AnswerService newAnswerService(Executor executor) {
    AnswerProperties answerProperties = new AnswerProperties();
    return new AnswerService(
        searchService,
        new PromptBuilder(answerProperties),
        chatModel,
        streamingChatModel,
        queryLogService,
        new SearchProperties(),
        answerProperties,
        new CompletionProperties("http://localhost", "key", "gpt-4o-mini", 0.3, 1000, 30),
        executor,
        Clock.fixed(Instant.parse("2026-03-03T12:00:00Z"), ZoneOffset.UTC));
  }

  private static ChatResponse completion(String text) {
    return ChatResponse.builder()
        .aiMessage(AiMessage.from(text))
        .tokenUsage(new TokenUsage(850, 120))
        .modelName("gpt-4o-mini-2024-07-18")
        .build();
  }

  private static List<StreamEvent> drain(AnswerStream stream) throws InterruptedException {
    List<StreamEvent> events = new ArrayList<>();
    StreamEvent event;
    while ((event = stream.poll(Duration.ZERO)) != null) {
      events.add(event);
    }
    return events;
  }

  // --- Blocking query ---

  @Test
  void queryWithNoChunksAnswersWithoutCompletionOrLog() {
    when(searchService.search(any())).thenReturn(List.of());

    AnswerResponse response = answerService.query(AnswerRequest.of(COLLECTION, QUESTION));

    assertThat(response.answer()).isEqualTo(AnswerService.NO_INFORMATION_ANSWER);
    assertThat(response.sources()).isEmpty();
    assertThat(response.queryId()).isNotNull();
    assertThat(response.metadata().model()).isEqualTo("none");
    assertThat(response.metadata().promptTokens()).isZero();
    assertThat(response.metadata().completionTokens()).isZero();
    assertThat(response.metadata().chunksRetrieved()).isZero();
    verifyNoInteractions(chatModel, queryLogService);
  }

  @Test
  void queryLogsBeforeReturningAndReportsSourcesAndUsage() {
    when(searchService.search(any())).thenReturn(chunks);
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(completion("Make an Athletics check [Page 195, Combat]."));
    when(queryLogService.log(any())).thenReturn(QUERY_ID);

    AnswerResponse response = answerService.query(AnswerRequest.of(COLLECTION, QUESTION));

    InOrder order = inOrder(searchService, chatModel, queryLogService);
    order.verify(searchService).search(any());
    order.verify(chatModel).chat(any(ChatRequest.class));
    order.verify(queryLogService).log(entryCaptor.capture());
    QueryLogEntry entry = entryCaptor.getValue();
    assertThat(entry.collectionId()).isEqualTo(COLLECTION);
    assertThat(entry.queryText()).isEqualTo(QUESTION);
    assertThat(entry.chunkIds())
        .containsExactly(chunks.get(0).chunkId(), chunks.get(1).chunkId());
    assertThat(entry.chunkScores()).containsExactly(0.03, 0.03);
    assertThat(entry.model()).isEqualTo("gpt-4o-mini-2024-07-18");
    assertThat(entry.promptTokens()).isEqualTo(850);
    assertThat(entry.completionTokens()).isEqualTo(120);

    assertThat(response.queryId()).isEqualTo(QUERY_ID);
    assertThat(response.answer()).isEqualTo("Make an Athletics check [Page 195, Combat].");
    assertThat(response.sources())
        .extracting(SourceReference::rank, SourceReference::pageNumber)
        .containsExactly(tuple(1, 195), tuple(2, 290));
    assertThat(response.metadata().chunksRetrieved()).isEqualTo(2);
    assertThat(response.metadata().conversationId()).isEqualTo(entry.conversationId());
  }

  @Test
  void retrievalIsHybridWithDefaultTopKAndResourceFilter() {
    UUID resource = UUID.randomUUID();
    when(searchService.search(searchCaptor.capture())).thenReturn(List.of());

    answerService.query(
        new AnswerRequest(COLLECTION, QUESTION, null, List.of(resource), null, List.of()));

    SearchRequest search = searchCaptor.getValue();
    assertThat(search.mode()).isEqualTo(SearchMode.HYBRID);
    assertThat(search.topK()).isEqualTo(10);
    assertThat(search.filters().resourceIds()).containsExactly(resource);
  }

  @Test
  void givenConversationIdIsKept() {
    UUID conversation = UUID.randomUUID();
    when(searchService.search(any())).thenReturn(chunks);
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(completion("Answer."));
    when(queryLogService.log(any())).thenReturn(QUERY_ID);

    AnswerResponse response =
        answerService.query(
            new AnswerRequest(COLLECTION, QUESTION, 5, List.of(), conversation, List.of()));

    verify(queryLogService).log(entryCaptor.capture());
    assertThat(entryCaptor.getValue().conversationId()).isEqualTo(conversation);
    assertThat(response.metadata().conversationId()).isEqualTo(conversation);
  }

  @Test
  void missingModelNameAndUsageFallBackToConfiguration() {
    when(searchService.search(any())).thenReturn(chunks);
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("Answer.")).build());
    when(queryLogService.log(any())).thenReturn(QUERY_ID);

    AnswerResponse response = answerService.query(AnswerRequest.of(COLLECTION, QUESTION));

    assertThat(response.metadata().model()).isEqualTo("gpt-4o-mini");
    assertThat(response.metadata().promptTokens()).isZero();
    assertThat(response.metadata().completionTokens()).isZero();
  }

  @Test
  void completionFailureIsReportedAndNotLogged() {
    when(searchService.search(any())).thenReturn(chunks);
    when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("HTTP 503"));

    assertThatThrownBy(() -> answerService.query(AnswerRequest.of(COLLECTION, QUESTION)))
        .isInstanceOf(CompletionProviderException.class)
        .hasMessage("Failed to generate answer: HTTP 503");
    verifyNoInteractions(queryLogService);
  }

  @Test
  void logFailureFailsTheQuery() {
    when(searchService.search(any())).thenReturn(chunks);
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(completion("Answer."));
    when(queryLogService.log(any()))
        .thenThrow(new QueryLoggingException("Failed to log query: db down", null));

    assertThatThrownBy(() -> answerService.query(AnswerRequest.of(COLLECTION, QUESTION)))
        .isInstanceOf(QueryLoggingException.class);
  }

  // --- Streaming query ---

  @Test
  void streamEmitsFragmentsThenDoneAfterLogging() throws InterruptedException {
    when(searchService.search(any())).thenReturn(chunks);
    when(queryLogService.log(any())).thenReturn(QUERY_ID);
    doAnswer(
            inv -> {
              StreamingChatResponseHandler handler = inv.getArgument(1);
              handler.onPartialResponse("Make an ");
              handler.onPartialResponse("Athletics check.");
              handler.onCompleteResponse(completion("Make an Athletics check."));
              return null;
            })
        .when(streamingChatModel)
        .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

    AnswerStream stream = answerService.streamQuery(AnswerRequest.of(COLLECTION, QUESTION));

    List<StreamEvent> events = drain(stream);
    assertThat(events).hasSize(3);
    assertThat(events.get(0)).isEqualTo(new StreamEvent.Chunk("Make an "));
    assertThat(events.get(1)).isEqualTo(new StreamEvent.Chunk("Athletics check."));
    assertThat(events.get(2))
        .isInstanceOfSatisfying(
            StreamEvent.Done.class,
            done -> {
              assertThat(done.queryId()).isEqualTo(QUERY_ID);
              assertThat(done.sources()).hasSize(2);
              assertThat(done.metadata().promptTokens()).isEqualTo(850);
            });
    assertThat(stream.completion().join().answer()).isEqualTo("Make an Athletics check.");
    verify(queryLogService).log(any());
  }

  @Test
  void streamWithNoChunksSendsFallbackThenDone() throws InterruptedException {
    when(searchService.search(any())).thenReturn(List.of());

    AnswerStream stream = answerService.streamQuery(AnswerRequest.of(COLLECTION, QUESTION));

    List<StreamEvent> events = drain(stream);
    assertThat(events).hasSize(2);
    assertThat(events.get(0))
        .isEqualTo(new StreamEvent.Chunk(AnswerService.NO_INFORMATION_ANSWER));
    assertThat(events.get(1)).isInstanceOf(StreamEvent.Done.class);
    verifyNoInteractions(streamingChatModel, queryLogService);
  }

  @Test
  void streamProviderErrorEndsWithErrorEventAndIsNotLogged() throws InterruptedException {
    when(searchService.search(any())).thenReturn(chunks);
    doAnswer(
            inv -> {
              StreamingChatResponseHandler handler = inv.getArgument(1);
              handler.onPartialResponse("Make ");
              handler.onError(new RuntimeException("connection reset"));
              return null;
            })
        .when(streamingChatModel)
        .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

    AnswerStream stream = answerService.streamQuery(AnswerRequest.of(COLLECTION, QUESTION));

    List<StreamEvent> events = drain(stream);
    assertThat(events)
        .containsExactly(
            new StreamEvent.Chunk("Make "),
            new StreamEvent.Failed("Failed to generate streaming answer: connection reset"));
    assertThatThrownBy(() -> stream.completion().join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(CompletionProviderException.class);
    verify(queryLogService, never()).log(any());
  }

  @Test
  void streamRetrievalFailureEndsWithErrorEvent() throws InterruptedException {
    when(searchService.search(any()))
        .thenThrow(new DataAccessResourceFailureException("connection lost"));

    AnswerStream stream = answerService.streamQuery(AnswerRequest.of(COLLECTION, QUESTION));

    assertThat(drain(stream)).containsExactly(new StreamEvent.Failed("connection lost"));
    verifyNoInteractions(streamingChatModel);
  }

  @Test
  void detachedStreamStillLogsTheAnswer() throws InterruptedException {
    when(searchService.search(any())).thenReturn(chunks);
    when(queryLogService.log(any())).thenReturn(QUERY_ID);
    List<AnswerStream> created = new ArrayList<>();
    doAnswer(
            inv -> {
              StreamingChatResponseHandler handler = inv.getArgument(1);
              handler.onPartialResponse("Make an ");
              created.get(0).detach();
              handler.onPartialResponse("Athletics check.");
              handler.onCompleteResponse(completion("Make an Athletics check."));
              return null;
            })
        .when(streamingChatModel)
        .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
    AnswerService deferred = newAnswerService(pending::add);

    AnswerStream stream = deferred.streamQuery(AnswerRequest.of(COLLECTION, QUESTION));
    created.add(stream);
    pending.remove(0).run();

    assertThat(drain(stream)).isEmpty();
    assertThat(stream.completion().join().queryId()).isEqualTo(QUERY_ID);
    verify(queryLogService).log(any());
  }
}
