package dev.lorekeeper.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import dev.langchain4j.data.embedding.Embedding;
import dev.lorekeeper.BaseIntegrationTest;
import dev.lorekeeper.resource.Resource;
import dev.lorekeeper.resource.ResourceRepository;
import dev.lorekeeper.resource.ResourceStatus;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class JdbcChunkEmbeddingStoreIT extends BaseIntegrationTest {

  @Autowired ChunkEmbeddingStore store;

  @Autowired ResourceRepository resourceRepository;

  @Autowired ResourceChunkRepository chunkRepository;

  private Resource resource(UUID collectionId, ResourceStatus status) {
    Resource resource = new Resource(collectionId, "dungeon-guide.pdf", "c/dungeon-guide.pdf");
    resource.setStatus(status);
    return resourceRepository.saveAndFlush(resource);
  }

  private List<ResourceChunk> chunks(Resource resource, int count) {
    List<ResourceChunk> chunks =
        IntStream.range(0, count)
            .mapToObj(
                i ->
                    new ResourceChunk(
                        resource.getId(), i, i + 1, "Chunk text " + i, 3, null, Map.of()))
            .toList();
    return chunkRepository.saveAllAndFlush(chunks);
  }

  @Test
  void pendingChunksComeBackInChunkOrder() {
    Resource resource = resource(UUID.randomUUID(), ResourceStatus.COMPLETED_NO_EMBEDDINGS);
    List<ResourceChunk> saved = chunks(resource, 3);

    List<PendingChunk> pending = store.findPendingChunks(resource.getId());

    assertThat(pending)
        .extracting(PendingChunk::chunkIndex, PendingChunk::text)
        .containsExactly(
            tuple(0, "Chunk text 0"),
            tuple(1, "Chunk text 1"),
            tuple(2, "Chunk text 2"));
    assertThat(pending.get(0).id()).isEqualTo(saved.get(0).getId());
  }

  @Test
  void writeBatchFillsOnlyNullEmbeddings() {
    Resource resource = resource(UUID.randomUUID(), ResourceStatus.COMPLETED_NO_EMBEDDINGS);
    List<ResourceChunk> saved = chunks(resource, 2);
    UUID first = saved.get(0).getId();

    int written = store.writeBatch(List.of(new ChunkVector(first, Embedding.from(axis(0)))));
    int rewritten = store.writeBatch(List.of(new ChunkVector(first, Embedding.from(axis(1)))));

    assertThat(written).isEqualTo(1);
    assertThat(rewritten).isZero();
    assertThat(chunkRepository.countPendingEmbeddings(resource.getId())).isEqualTo(1);
    Double firstComponent =
        jdbcTemplate.queryForObject(
            "SELECT (embedding::real[])[1] FROM resource_chunks WHERE id = ?",
            Double.class,
            first);
    assertThat(firstComponent).isEqualTo(1.0);
  }

  @Test
  void writeBatchOfNothingWritesNothing() {
    assertThat(store.writeBatch(List.of())).isZero();
  }

  @Test
  void resourcesWithPendingChunksExcludeUnfinishedAndFullyEmbedded() {
    UUID collection = UUID.randomUUID();
    Resource pending = resource(collection, ResourceStatus.COMPLETED_NO_EMBEDDINGS);
    chunks(pending, 2);
    Resource processing = resource(collection, ResourceStatus.PROCESSING);
    chunks(processing, 2);
    Resource embedded = resource(collection, ResourceStatus.COMPLETED);
    List<ResourceChunk> embeddedChunks = chunks(embedded, 1);
    store.writeBatch(
        List.of(new ChunkVector(embeddedChunks.get(0).getId(), Embedding.from(axis(2)))));
    Resource elsewhere = resource(UUID.randomUUID(), ResourceStatus.COMPLETED_NO_EMBEDDINGS);
    chunks(elsewhere, 1);

    assertThat(store.findResourcesWithPendingChunks(null, collection))
        .containsExactly(pending.getId());
    assertThat(store.findResourcesWithPendingChunks(null, null))
        .containsExactlyInAnyOrder(pending.getId(), elsewhere.getId());
    assertThat(store.findResourcesWithPendingChunks(elsewhere.getId(), collection)).isEmpty();
  }

  @Test
  void chunkEntityRoundtripsTagsAndMetadata() {
    Resource resource = resource(UUID.randomUUID(), ResourceStatus.COMPLETED);
    ResourceChunk chunk =
        new ResourceChunk(
            resource.getId(),
            0,
            12,
            "Owlbears nest in old forests.",
            7,
            "OWLBEAR",
            Map.of("startOffset", 40, "endOffset", 69));
    chunk.setTags(new String[] {"monster", "forest"});
    UUID id = chunkRepository.saveAndFlush(chunk).getId();

    ResourceChunk found = chunkRepository.findById(id).orElseThrow();

    assertThat(found.getTags()).containsExactly("monster", "forest");
    assertThat(found.getMetadata()).containsEntry("startOffset", 40);
    assertThat(found.getSectionHeading()).isEqualTo("OWLBEAR");
    assertThat(found.getCreatedAt()).isNotNull();
  }
}
