package dev.lorekeeper.document;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Persistence seam for chunk vectors.
 *
 * <p>Writes only ever fill a null embedding, which makes re-running an embedding pass safe: a
 * chunk that already has a vector is never re-embedded or overwritten.
 */
public interface ChunkEmbeddingStore {

  /**
   * Returns the chunks of a resource that have no embedding yet, in chunk order.
   *
   * @param resourceId the owning resource
   * @return pending chunks ordered by chunk index
   */
  List<PendingChunk> findPendingChunks(UUID resourceId);

  /**
   * Finds finished resources that still have chunks without an embedding, oldest upload first.
   * Resources still being processed are excluded.
   *
   * @param resourceId restrict to this resource, or {@code null}
   * @param collectionId restrict to this collection, or {@code null}
   * @return matching resource identifiers
   */
  List<UUID> findResourcesWithPendingChunks(@Nullable UUID resourceId, @Nullable UUID collectionId);

  /**
   * Writes a batch of vectors in one transaction: either every update of the batch commits or none
   * does. A chunk that already has an embedding is left untouched.
   *
   * @param vectors the vectors to write
   * @return number of chunks whose embedding was set
   */
  int writeBatch(List<ChunkVector> vectors);
}
