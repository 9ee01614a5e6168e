package dev.lorekeeper.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.lorekeeper.embedding.EmbeddingProviderExhaustedException;
import dev.lorekeeper.embedding.EmbeddingService;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class HybridSearchServiceTest {

  private static final UUID COLLECTION = UUID.randomUUID();
  private static final String QUERY = "how does grappling work";
  private static final Embedding QUERY_EMBEDDING = Embedding.from(new float[] {0.1f, 0.2f});

  @Mock ChunkSearchRepository repository;

  @Mock EmbeddingService embeddingService;

  HybridSearchService searchService;

  @BeforeEach
  void setUp() {
    SearchProperties properties = new SearchProperties();
    properties.setCandidateMultiplier(2);
    properties.setMaxTopK(20);
    searchService =
        new HybridSearchService(repository, embeddingService, properties, Runnable::run);
  }

  private static ScoredChunk hit(String id, MatchSource source) {
    return ReciprocalRankFusionTest.chunk(
        UUID.nameUUIDFromBytes(id.getBytes(StandardCharsets.UTF_8)), 0.5, source);
  }

  // --- Hybrid ---

  @Test
  void hybridFetchesDoubleCandidatesFromBothListsAndFuses() {
    ScoredChunk shared = hit("shared", MatchSource.VECTOR);
    ScoredChunk vectorOnly = hit("vector-only", MatchSource.VECTOR);
    ScoredChunk keywordOnly = hit("keyword-only", MatchSource.KEYWORD);
    when(embeddingService.embedQuery(QUERY)).thenReturn(QUERY_EMBEDDING);
    when(repository.vectorSearch(COLLECTION, QUERY_EMBEDDING, 10, SearchFilters.NONE))
        .thenReturn(List.of(shared, vectorOnly));
    when(repository.keywordSearch(COLLECTION, QUERY, 10, SearchFilters.NONE))
        .thenReturn(List.of(keywordOnly, shared));

    List<ScoredChunk> results = searchService.search(new SearchRequest(COLLECTION, QUERY, 5));

    assertThat(results)
        .extracting(ScoredChunk::chunkId)
        .containsExactly(shared.chunkId(), keywordOnly.chunkId(), vectorOnly.chunkId());
    assertThat(results.get(0).source()).isEqualTo(MatchSource.HYBRID);
  }

  @Test
  void hybridKeepsTopK() {
    when(embeddingService.embedQuery(QUERY)).thenReturn(QUERY_EMBEDDING);
    when(repository.vectorSearch(eq(COLLECTION), eq(QUERY_EMBEDDING), eq(2), any()))
        .thenReturn(List.of(hit("a", MatchSource.VECTOR), hit("b", MatchSource.VECTOR)));
    when(repository.keywordSearch(eq(COLLECTION), eq(QUERY), eq(2), any()))
        .thenReturn(List.of(hit("c", MatchSource.KEYWORD), hit("d", MatchSource.KEYWORD)));

    assertThat(searchService.search(new SearchRequest(COLLECTION, QUERY, 1))).hasSize(1);
  }

  @Test
  void hybridFallsBackToKeywordResultsWhenQueryEmbeddingFails() {
    ScoredChunk keywordOnly = hit("keyword-only", MatchSource.KEYWORD);
    when(embeddingService.embedQuery(QUERY))
        .thenThrow(new EmbeddingProviderExhaustedException(6, null));
    when(repository.keywordSearch(COLLECTION, QUERY, 10, SearchFilters.NONE))
        .thenReturn(List.of(keywordOnly));

    List<ScoredChunk> results = searchService.search(new SearchRequest(COLLECTION, QUERY, 5));

    assertThat(results).extracting(ScoredChunk::chunkId).containsExactly(keywordOnly.chunkId());
    assertThat(results.get(0).source()).isEqualTo(MatchSource.KEYWORD);
    verify(repository, never()).vectorSearch(any(), any(), anyInt(), any());
  }

  @Test
  void hybridPropagatesDatabaseFailures() {
    when(embeddingService.embedQuery(QUERY)).thenReturn(QUERY_EMBEDDING);
    when(repository.vectorSearch(any(), any(), anyInt(), any()))
        .thenThrow(new DataAccessResourceFailureException("connection lost"));

    assertThatThrownBy(() -> searchService.search(new SearchRequest(COLLECTION, QUERY, 5)))
        .isInstanceOf(DataAccessResourceFailureException.class);
  }

  // --- Single-list modes ---

  @Test
  void vectorModeUsesOnlyTheVectorList() {
    SearchFilters filters = SearchFilters.resources(List.of(UUID.randomUUID()));
    when(embeddingService.embedQuery(QUERY)).thenReturn(QUERY_EMBEDDING);
    when(repository.vectorSearch(COLLECTION, QUERY_EMBEDDING, 3, filters))
        .thenReturn(List.of(hit("a", MatchSource.VECTOR)));

    List<ScoredChunk> results =
        searchService.search(new SearchRequest(COLLECTION, QUERY, 3, SearchMode.VECTOR, filters));

    assertThat(results).hasSize(1);
    verify(repository, never()).keywordSearch(any(), any(), anyInt(), any());
  }

  @Test
  void vectorModePropagatesEmbeddingFailure() {
    when(embeddingService.embedQuery(QUERY))
        .thenThrow(new EmbeddingProviderExhaustedException(6, null));

    assertThatThrownBy(
            () ->
                searchService.search(
                    new SearchRequest(COLLECTION, QUERY, 3, SearchMode.VECTOR, null)))
        .isInstanceOf(EmbeddingProviderExhaustedException.class);
  }

  @Test
  void keywordModeNeverEmbedsTheQuery() {
    when(repository.keywordSearch(COLLECTION, QUERY, 3, SearchFilters.NONE))
        .thenReturn(List.of(hit("a", MatchSource.KEYWORD)));

    assertThat(
            searchService.search(new SearchRequest(COLLECTION, QUERY, 3, SearchMode.KEYWORD, null)))
        .hasSize(1);
    verifyNoInteractions(embeddingService);
  }

  // --- Validation ---

  @Test
  void topKAboveMaximumIsRejected() {
    assertThatThrownBy(() -> searchService.search(new SearchRequest(COLLECTION, QUERY, 21)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("topK must be at most 20, got: 21");
    verifyNoInteractions(repository, embeddingService);
  }
}
