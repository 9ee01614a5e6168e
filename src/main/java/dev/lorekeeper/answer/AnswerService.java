package dev.lorekeeper.answer;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import dev.lorekeeper.querylog.QueryLogEntry;
import dev.lorekeeper.querylog.QueryLogService;
import dev.lorekeeper.search.HybridSearchService;
import dev.lorekeeper.search.ScoredChunk;
import dev.lorekeeper.search.SearchFilters;
import dev.lorekeeper.search.SearchMode;
import dev.lorekeeper.search.SearchProperties;
import dev.lorekeeper.search.SearchRequest;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Answers questions from a collection's documents.
 *
 * <p>Pipeline: hybrid search for the top excerpts -> grounded prompt via {@link PromptBuilder} ->
 * completion (blocking or streamed) -> query log row -> response. The log row is written before the
 * answer is returned or the stream's {@code done} event is emitted; if it cannot be written the
 * query fails.
 *
 * <p>A query that retrieves no excerpts never reaches the completion provider. It gets a fixed
 * answer with zero token usage and a fresh query id, and is not logged.
 */
@Service
public class AnswerService {

  private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

  static final String NO_INFORMATION_ANSWER =
      "I don't have any information about that in your uploaded materials. You may need to upload"
          + " relevant resources first, or try rephrasing your question.";
  static final String NO_MODEL = "none";
  private static final int LOGGED_QUERY_LENGTH = 100;

  private final HybridSearchService searchService;
  private final PromptBuilder promptBuilder;
  private final ChatModel chatModel;
  private final StreamingChatModel streamingChatModel;
  private final QueryLogService queryLogService;
  private final SearchProperties searchProperties;
  private final AnswerProperties answerProperties;
  private final CompletionProperties completionProperties;
  private final Executor executor;
  private final Clock clock;

  public AnswerService(
      HybridSearchService searchService,
      PromptBuilder promptBuilder,
      ChatModel chatModel,
      StreamingChatModel streamingChatModel,
      QueryLogService queryLogService,
      SearchProperties searchProperties,
      AnswerProperties answerProperties,
      CompletionProperties completionProperties,
      @Qualifier("answerStreamExecutor") Executor executor,
      Clock clock) {
    this.searchService = searchService;
    this.promptBuilder = promptBuilder;
    this.chatModel = chatModel;
    this.streamingChatModel = streamingChatModel;
    this.queryLogService = queryLogService;
    this.searchProperties = searchProperties;
    this.answerProperties = answerProperties;
    this.completionProperties = completionProperties;
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Answers a question with a single blocking completion call.
   *
   * @param request the question and retrieval options
   * @return the logged answer with sources and usage
   * @throws CompletionProviderException if the completion provider fails
   * @throws dev.lorekeeper.querylog.QueryLoggingException if the query cannot be logged
   */
  public AnswerResponse query(AnswerRequest request) {
    long startMs = clock.millis();
    UUID conversationId = conversationId(request);
    log.info(
        "Query started for collection {}: {}", request.collectionId(), preview(request.query()));

    List<ScoredChunk> chunks = retrieve(request);
    long searchLatencyMs = clock.millis() - startMs;
    if (chunks.isEmpty()) {
      return noInformation(request, conversationId, startMs, searchLatencyMs);
    }

    ChatRequest chatRequest = chatRequest(request, chunks);
    long llmStartMs = clock.millis();
    ChatResponse response;
    try {
      response = chatModel.chat(chatRequest);
    } catch (RuntimeException e) {
      log.error("Answer generation failed for query: {}", preview(request.query()), e);
      throw new CompletionProviderException("Failed to generate answer: " + e.getMessage(), e);
    }
    long llmLatencyMs = clock.millis() - llmStartMs;

    return finish(
        request, conversationId, chunks, response, startMs, searchLatencyMs, llmLatencyMs);
  }

  /**
   * Answers a question with a streamed completion. Retrieval and generation run on the {@code
   * answerStreamExecutor} pool; the returned stream receives text fragments followed by a {@code
   * done} or {@code error} event.
   *
   * @param request the question and retrieval options
   * @return the event stream for this query
   * @throws org.springframework.core.task.TaskRejectedException if the stream pool is saturated
   */
  public AnswerStream streamQuery(AnswerRequest request) {
    AnswerStream stream = new AnswerStream();
    executor.execute(() -> runStream(request, stream));
    return stream;
  }

  private void runStream(AnswerRequest request, AnswerStream stream) {
    long startMs = clock.millis();
    UUID conversationId = conversationId(request);
    log.info(
        "Streaming query started for collection {}: {}",
        request.collectionId(),
        preview(request.query()));

    List<ScoredChunk> chunks;
    try {
      chunks = retrieve(request);
    } catch (RuntimeException e) {
      log.error("Retrieval failed for streaming query: {}", preview(request.query()), e);
      stream.fail(e);
      return;
    }
    long searchLatencyMs = clock.millis() - startMs;
    if (chunks.isEmpty()) {
      AnswerResponse fallback = noInformation(request, conversationId, startMs, searchLatencyMs);
      stream.emit(new StreamEvent.Chunk(fallback.answer()));
      stream.complete(fallback);
      return;
    }

    ChatRequest chatRequest = chatRequest(request, chunks);
    long llmStartMs = clock.millis();
    try {
      streamingChatModel.chat(
          chatRequest,
          new StreamingChatResponseHandler() {
            @Override
            public void onPartialResponse(String partialResponse) {
              stream.emit(new StreamEvent.Chunk(partialResponse));
            }

            @Override
            public void onCompleteResponse(ChatResponse response) {
              long llmLatencyMs = clock.millis() - llmStartMs;
              if (stream.isDetached()) {
                log.info("Client detached before completion, finalising query anyway");
              }
              try {
                stream.complete(
                    finish(
                        request,
                        conversationId,
                        chunks,
                        response,
                        startMs,
                        searchLatencyMs,
                        llmLatencyMs));
              } catch (RuntimeException e) {
                stream.fail(e);
              }
            }

            @Override
            public void onError(Throwable error) {
              log.error("Streaming answer failed for query: {}", preview(request.query()), error);
              stream.fail(
                  new CompletionProviderException(
                      "Failed to generate streaming answer: " + error.getMessage(), error));
            }
          });
    } catch (RuntimeException e) {
      log.error("Streaming answer failed for query: {}", preview(request.query()), e);
      stream.fail(
          new CompletionProviderException(
              "Failed to generate streaming answer: " + e.getMessage(), e));
    }
  }

  private List<ScoredChunk> retrieve(AnswerRequest request) {
    int topK = request.topK() != null ? request.topK() : searchProperties.getDefaultTopK();
    return searchService.search(
        new SearchRequest(
            request.collectionId(),
            request.query(),
            topK,
            SearchMode.HYBRID,
            SearchFilters.resources(request.resourceIds())));
  }

  private ChatRequest chatRequest(AnswerRequest request, List<ScoredChunk> chunks) {
    List<ChatMessage> messages = promptBuilder.build(request.query(), chunks, request.history());
    return ChatRequest.builder().messages(messages).build();
  }

  private AnswerResponse finish(
      AnswerRequest request,
      UUID conversationId,
      List<ScoredChunk> chunks,
      ChatResponse response,
      long startMs,
      long searchLatencyMs,
      long llmLatencyMs) {
    String text = response.aiMessage().text();
    String answer = text == null ? "" : text;
    TokenUsage usage = response.tokenUsage();
    int promptTokens = tokens(usage == null ? null : usage.inputTokenCount());
    int completionTokens = tokens(usage == null ? null : usage.outputTokenCount());
    String model =
        response.modelName() != null ? response.modelName() : completionProperties.model();
    long latencyMs = clock.millis() - startMs;

    UUID queryId =
        queryLogService.log(
            new QueryLogEntry(
                request.collectionId(),
                request.query(),
                chunks.stream().map(ScoredChunk::chunkId).toList(),
                chunks.stream().map(ScoredChunk::score).toList(),
                answer,
                model,
                promptTokens,
                completionTokens,
                latencyMs,
                conversationId));

    if (latencyMs > answerProperties.getLatencyTargetMs()) {
      log.warn(
          "Query {} took {}ms, above the {}ms target (search {}ms, completion {}ms)",
          queryId,
          latencyMs,
          answerProperties.getLatencyTargetMs(),
          searchLatencyMs,
          llmLatencyMs);
    }
    log.info(
        "Query {} completed: {} chunks, {} prompt + {} completion tokens, {}ms",
        queryId,
        chunks.size(),
        promptTokens,
        completionTokens,
        latencyMs);

    return new AnswerResponse(
        queryId,
        answer,
        sources(chunks),
        new QueryMetadata(
            model,
            promptTokens,
            completionTokens,
            latencyMs,
            searchLatencyMs,
            llmLatencyMs,
            chunks.size(),
            conversationId));
  }

  private AnswerResponse noInformation(
      AnswerRequest request, UUID conversationId, long startMs, long searchLatencyMs) {
    log.info(
        "No chunks found in collection {}, answering without completion: {}",
        request.collectionId(),
        preview(request.query()));
    return new AnswerResponse(
        UUID.randomUUID(),
        NO_INFORMATION_ANSWER,
        List.of(),
        new QueryMetadata(
            NO_MODEL, 0, 0, clock.millis() - startMs, searchLatencyMs, 0, 0, conversationId));
  }

  private List<SourceReference> sources(List<ScoredChunk> chunks) {
    int previewLength = answerProperties.getPreviewLength();
    return IntStream.range(0, chunks.size())
        .mapToObj(i -> SourceReference.from(chunks.get(i), i + 1, previewLength))
        .toList();
  }

  private static UUID conversationId(AnswerRequest request) {
    return request.conversationId() != null ? request.conversationId() : UUID.randomUUID();
  }

  private static int tokens(@Nullable Integer count) {
    return count == null ? 0 : count;
  }

  private static String preview(String query) {
    return query.length() <= LOGGED_QUERY_LENGTH ? query : query.substring(0, LOGGED_QUERY_LENGTH);
  }
}
