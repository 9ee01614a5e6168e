package dev.lorekeeper.ingestion;

import dev.lorekeeper.document.PendingChunk;
import dev.lorekeeper.document.ResourceChunk;
import dev.lorekeeper.document.ResourceChunkRepository;
import dev.lorekeeper.ingestion.chunking.ChunkData;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Stores the chunks of a resource, replacing whatever an earlier run left behind. */
@Component
public class ResourceChunkWriter {

  private static final Logger log = LoggerFactory.getLogger(ResourceChunkWriter.class);

  private final ResourceChunkRepository repository;

  public ResourceChunkWriter(ResourceChunkRepository repository) {
    this.repository = repository;
  }

  /**
   * Deletes the resource's existing chunks and inserts the new ones in a single transaction.
   *
   * @param resourceId the owning resource
   * @param chunks chunks in document order; list position becomes the chunk index
   * @return the stored chunks, ready for embedding
   */
  @Transactional
  public List<PendingChunk> replaceChunks(UUID resourceId, List<ChunkData> chunks) {
    int removed = repository.deleteByResourceId(resourceId);
    if (removed > 0) {
      log.info("Resource {}: removed {} chunks from a previous run", resourceId, removed);
    }

    List<ResourceChunk> entities = new ArrayList<>(chunks.size());
    for (int index = 0; index < chunks.size(); index++) {
      ChunkData chunk = chunks.get(index);
      entities.add(
          new ResourceChunk(
              resourceId,
              index,
              chunk.pageNumber(),
              chunk.content(),
              chunk.tokenCount(),
              chunk.sectionHeading(),
              Map.of("startOffset", chunk.startOffset(), "endOffset", chunk.endOffset())));
    }
    return repository.saveAll(entities).stream()
        .map(c -> new PendingChunk(c.getId(), c.getChunkIndex(), c.getRawText()))
        .toList();
  }
}
