package dev.lorekeeper.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.lorekeeper.BaseIntegrationTest;
import dev.lorekeeper.document.ChunkEmbeddingStore;
import dev.lorekeeper.document.ChunkVector;
import dev.lorekeeper.document.ResourceChunk;
import dev.lorekeeper.document.ResourceChunkRepository;
import dev.lorekeeper.embedding.EmbeddingBatch;
import dev.lorekeeper.embedding.EmbeddingProviderException;
import dev.lorekeeper.embedding.IndexedEmbedding;
import dev.lorekeeper.resource.Resource;
import dev.lorekeeper.resource.ResourceRepository;
import dev.lorekeeper.resource.ResourceStatus;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class HybridSearchIT extends BaseIntegrationTest {

  @Autowired HybridSearchService searchService;

  @Autowired ResourceRepository resourceRepository;

  @Autowired ResourceChunkRepository chunkRepository;

  @Autowired ChunkEmbeddingStore embeddingStore;

  // --- Test data ---

  static final String GRAPPLING =
      "Grappling: when you want to grab a creature, make a Strength (Athletics) check.";
  static final String GRAPPLED =
      "A grappled creature's speed becomes zero until the grapple ends.";
  static final String FIREBALL = "Fireball deals 8d6 fire damage in a 20-foot radius sphere.";
  static final String SWARM = "Grappling a swarm is not possible; it slips through your hands.";

  final UUID collection = UUID.randomUUID();

  UUID grapplingId;
  UUID grappledId;
  UUID fireballId;
  UUID swarmId;
  UUID unembeddedResource;

  @BeforeEach
  void seedTestData() {
    Resource handbook = resource(collection, "players-handbook.pdf", ResourceStatus.COMPLETED);
    grapplingId = chunk(handbook, 0, 195, "Grappling", GRAPPLING, axis(0), new String[0]);
    grappledId = chunk(handbook, 1, 290, "Conditions", GRAPPLED, blend(1, 0), new String[0]);
    fireballId = chunk(handbook, 2, 241, "Spells", FIREBALL, axis(2), new String[] {"spell"});

    Resource bestiary =
        resource(collection, "bestiary.pdf", ResourceStatus.COMPLETED_NO_EMBEDDINGS);
    unembeddedResource = bestiary.getId();
    swarmId = chunk(bestiary, 0, 12, "Swarms", SWARM, null, new String[0]);

    Resource failed = resource(collection, "draft-rules.pdf", ResourceStatus.FAILED);
    chunk(failed, 0, 1, null, "Grapple rules draft.", axis(0), new String[0]);

    Resource elsewhere =
        resource(UUID.randomUUID(), "other-handbook.pdf", ResourceStatus.COMPLETED);
    chunk(elsewhere, 0, 1, null, "Grapple rules from another collection.", axis(0), new String[0]);

    when(embeddingProvider.embed(any()))
        .thenReturn(
            new EmbeddingBatch(List.of(new IndexedEmbedding(0, Embedding.from(axis(0)))), 2));
  }

  private Resource resource(UUID collectionId, String filename, ResourceStatus status) {
    Resource resource = new Resource(collectionId, filename, "uploads/" + filename);
    resource.setStatus(status);
    return resourceRepository.saveAndFlush(resource);
  }

  private UUID chunk(
      Resource resource,
      int index,
      int page,
      @Nullable String heading,
      String text,
      float @Nullable [] vector,
      String[] tags) {
    ResourceChunk chunk =
        new ResourceChunk(resource.getId(), index, page, text, 12, heading, Map.of());
    chunk.setTags(tags);
    UUID id = chunkRepository.saveAndFlush(chunk).getId();
    if (vector != null) {
      embeddingStore.writeBatch(List.of(new ChunkVector(id, Embedding.from(vector))));
    }
    return id;
  }

  // --- Hybrid ---

  @Test
  void hybridSearchFusesBothListsAndRanksSharedChunksFirst() {
    List<ScoredChunk> results =
        searchService.search(new SearchRequest(collection, "grapple", 5));

    assertThat(results)
        .extracting(ScoredChunk::chunkId, ScoredChunk::source)
        .containsExactlyInAnyOrder(
            tuple(grapplingId, MatchSource.HYBRID),
            tuple(grappledId, MatchSource.HYBRID),
            tuple(fireballId, MatchSource.VECTOR),
            tuple(swarmId, MatchSource.KEYWORD));
    assertThat(results.subList(0, 2))
        .extracting(ScoredChunk::chunkId)
        .containsExactlyInAnyOrder(grapplingId, grappledId);
    assertThat(results).isSortedAccordingTo((a, b) -> Double.compare(b.score(), a.score()));
  }

  @Test
  void searchResultsCarryCitationFields() {
    List<ScoredChunk> results =
        searchService.search(
            new SearchRequest(
                collection,
                "grapple",
                5,
                SearchMode.VECTOR,
                new SearchFilters(null, List.of(195), null)));

    assertThat(results).hasSize(1);
    ScoredChunk top = results.get(0);
    assertThat(top.chunkId()).isEqualTo(grapplingId);
    assertThat(top.content()).isEqualTo(GRAPPLING);
    assertThat(top.pageNumber()).isEqualTo(195);
    assertThat(top.sectionHeading()).isEqualTo("Grappling");
    assertThat(top.filename()).isEqualTo("players-handbook.pdf");
    assertThat(top.score()).isCloseTo(1.0, offset(1e-6));
  }

  @Test
  void hybridSearchFallsBackToKeywordsWhenQueryCannotBeEmbedded() {
    when(embeddingProvider.embed(any()))
        .thenThrow(new EmbeddingProviderException("Embedding provider returned HTTP 500: down"));

    List<ScoredChunk> results =
        searchService.search(new SearchRequest(collection, "grapple", 5));

    assertThat(results)
        .extracting(ScoredChunk::chunkId)
        .containsExactlyInAnyOrder(grapplingId, grappledId, swarmId);
    assertThat(results).allSatisfy(r -> assertThat(r.source()).isEqualTo(MatchSource.KEYWORD));
  }

  // --- Single mode ---

  @Test
  void keywordSearchNeverEmbedsTheQuery() {
    List<ScoredChunk> results =
        searchService.search(
            new SearchRequest(collection, "grapple", 5, SearchMode.KEYWORD, SearchFilters.NONE));

    assertThat(results)
        .extracting(ScoredChunk::chunkId)
        .containsExactlyInAnyOrder(grapplingId, grappledId, swarmId);
    assertThat(results).allSatisfy(r -> assertThat(r.score()).isPositive());
    verifyNoInteractions(embeddingProvider);
  }

  @Test
  void vectorSearchSkipsChunksWithoutEmbeddings() {
    List<ScoredChunk> results =
        searchService.search(
            new SearchRequest(collection, "grapple", 10, SearchMode.VECTOR, SearchFilters.NONE));

    assertThat(results)
        .extracting(ScoredChunk::chunkId)
        .containsExactly(grapplingId, grappledId, fireballId);
  }

  // --- Filters ---

  @Test
  void resourceFilterRestrictsBothLists() {
    List<ScoredChunk> results =
        searchService.search(
            new SearchRequest(
                collection,
                "grapple",
                5,
                SearchMode.HYBRID,
                SearchFilters.resources(List.of(unembeddedResource))));

    assertThat(results)
        .extracting(ScoredChunk::chunkId, ScoredChunk::source)
        .containsExactly(tuple(swarmId, MatchSource.KEYWORD));
  }

  @Test
  void tagFilterMatchesAnyListedTag() {
    List<ScoredChunk> results =
        searchService.search(
            new SearchRequest(
                collection,
                "fire damage",
                5,
                SearchMode.HYBRID,
                new SearchFilters(null, null, List.of("spell", "ritual"))));

    assertThat(results).extracting(ScoredChunk::chunkId).containsExactly(fireballId);
  }

  @Test
  void otherCollectionsAreNeverSearched() {
    List<ScoredChunk> results =
        searchService.search(new SearchRequest(UUID.randomUUID(), "grapple", 5));

    assertThat(results).isEmpty();
  }
}
