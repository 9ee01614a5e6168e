package dev.lorekeeper.search;

import dev.lorekeeper.embedding.EmbeddingProviderException;
import dev.lorekeeper.embedding.EmbeddingService;
import dev.langchain4j.data.embedding.Embedding;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Search orchestration layer: vector, keyword or hybrid retrieval over one collection.
 *
 * <p>Hybrid pipeline: fetch {@code topK * candidateMultiplier} candidates from the vector and
 * keyword queries in parallel on the {@code searchExecutor} pool, then fuse both lists with {@link
 * ReciprocalRankFusion} and keep {@code topK}.
 *
 * <p>If the query cannot be embedded, hybrid search degrades to keyword results alone. Vector-only
 * search propagates the provider failure.
 */
@Service
public class HybridSearchService {

  private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

  private final ChunkSearchRepository repository;
  private final EmbeddingService embeddingService;
  private final SearchProperties properties;
  private final Executor executor;

  public HybridSearchService(
      ChunkSearchRepository repository,
      EmbeddingService embeddingService,
      SearchProperties properties,
      @Qualifier("searchExecutor") Executor executor) {
    this.repository = repository;
    this.embeddingService = embeddingService;
    this.properties = properties;
    this.executor = executor;
  }

  /**
   * Runs the search described by the request.
   *
   * @param request collection, query, result limit, mode and filters
   * @return at most {@code topK} chunks, best first
   * @throws IllegalArgumentException if {@code topK} exceeds the configured maximum
   */
  public List<ScoredChunk> search(SearchRequest request) {
    if (request.topK() > properties.getMaxTopK()) {
      throw new IllegalArgumentException(
          "topK must be at most " + properties.getMaxTopK() + ", got: " + request.topK());
    }
    return switch (request.mode()) {
      case VECTOR ->
          vectorSearch(request.collectionId(), request.query(), request.topK(), request.filters());
      case KEYWORD ->
          repository.keywordSearch(
              request.collectionId(), request.query(), request.topK(), request.filters());
      case HYBRID ->
          hybridSearch(request.collectionId(), request.query(), request.topK(), request.filters());
    };
  }

  List<ScoredChunk> vectorSearch(
      UUID collectionId, String query, int limit, SearchFilters filters) {
    Embedding queryEmbedding = embeddingService.embedQuery(query);
    return repository.vectorSearch(collectionId, queryEmbedding, limit, filters);
  }

  List<ScoredChunk> hybridSearch(UUID collectionId, String query, int topK, SearchFilters filters) {
    int candidates = topK * properties.getCandidateMultiplier();

    CompletableFuture<List<ScoredChunk>> vector =
        CompletableFuture.supplyAsync(
                () -> vectorSearch(collectionId, query, candidates, filters), executor)
            .exceptionally(e -> degradeOnEmbeddingFailure(collectionId, e));
    CompletableFuture<List<ScoredChunk>> keyword =
        CompletableFuture.supplyAsync(
            () -> repository.keywordSearch(collectionId, query, candidates, filters), executor);

    List<ScoredChunk> vectorResults = await(vector);
    List<ScoredChunk> keywordResults = await(keyword);
    List<ScoredChunk> fused =
        ReciprocalRankFusion.fuse(vectorResults, keywordResults, properties.getRrfK(), topK);
    log.debug(
        "Hybrid search in collection {}: {} vector, {} keyword, {} fused",
        collectionId,
        vectorResults.size(),
        keywordResults.size(),
        fused.size());
    return fused;
  }

  private static List<ScoredChunk> degradeOnEmbeddingFailure(UUID collectionId, Throwable e) {
    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    if (cause instanceof EmbeddingProviderException) {
      log.warn(
          "Query embedding failed for collection {}, using keyword results only: {}",
          collectionId,
          cause.getMessage());
      return List.of();
    }
    throw e instanceof CompletionException ce ? ce : new CompletionException(cause);
  }

  private static List<ScoredChunk> await(CompletableFuture<List<ScoredChunk>> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
  }
}
