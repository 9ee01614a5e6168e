package dev.lorekeeper.api;

import dev.lorekeeper.answer.AnswerResponse;
import dev.lorekeeper.answer.AnswerService;
import dev.lorekeeper.answer.AnswerStream;
import dev.lorekeeper.querylog.QueryLogService;
import dev.lorekeeper.search.HybridSearchService;
import dev.lorekeeper.search.SearchProperties;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Question answering, retrieval-only search and answer feedback over a collection. */
@RestController
@RequestMapping("/api")
public class RagController {

  /** Upper bound on a streamed answer's connection. */
  static final long STREAM_TIMEOUT_MS = 120_000;

  private final AnswerService answerService;
  private final HybridSearchService searchService;
  private final QueryLogService queryLogService;
  private final AnswerStreamRelay relay;
  private final SearchProperties searchProperties;

  public RagController(
      AnswerService answerService,
      HybridSearchService searchService,
      QueryLogService queryLogService,
      AnswerStreamRelay relay,
      SearchProperties searchProperties) {
    this.answerService = answerService;
    this.searchService = searchService;
    this.queryLogService = queryLogService;
    this.relay = relay;
    this.searchProperties = searchProperties;
  }

  @PostMapping("/collections/{collectionId}/rag/query")
  public AnswerResponse query(
      @PathVariable UUID collectionId, @Valid @RequestBody QueryRequestBody body) {
    return answerService.query(body.toAnswerRequest(collectionId));
  }

  /**
   * Streams an answer as server-sent events: {@code chunk} events carrying text fragments, then one
   * {@code done} event with the query id, sources and metadata, or one {@code error} event.
   */
  @PostMapping(
      value = "/collections/{collectionId}/rag/query/stream",
      produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter queryStream(
      @PathVariable UUID collectionId, @Valid @RequestBody QueryRequestBody body) {
    AnswerStream stream = answerService.streamQuery(body.toAnswerRequest(collectionId));
    SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
    relay.relay(stream, emitter);
    return emitter;
  }

  @PostMapping("/collections/{collectionId}/rag/search")
  public SearchResponse search(
      @PathVariable UUID collectionId, @Valid @RequestBody SearchRequestBody body) {
    return SearchResponse.of(
        searchService.search(
            body.toSearchRequest(collectionId, searchProperties.getDefaultTopK())));
  }

  @PostMapping("/rag/queries/{queryId}/feedback")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void feedback(@PathVariable UUID queryId, @Valid @RequestBody FeedbackRequestBody body) {
    queryLogService.recordFeedback(queryId, body.rating(), body.comment());
  }
}
