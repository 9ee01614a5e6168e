package dev.lorekeeper.document;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link ResourceChunk} entities. */
public interface ResourceChunkRepository extends JpaRepository<ResourceChunk, UUID> {

  List<ResourceChunk> findByResourceIdOrderByChunkIndexAsc(UUID resourceId);

  long countByResourceId(UUID resourceId);

  /**
   * Deletes every chunk of a resource. Used before re-inserting chunks so a redelivered job never
   * leaves duplicates behind.
   *
   * @param resourceId the owning resource
   * @return number of chunks removed
   */
  @Modifying
  @Query("DELETE FROM ResourceChunk c WHERE c.resourceId = :resourceId")
  int deleteByResourceId(@Param("resourceId") UUID resourceId);

  /**
   * Counts chunks of a resource whose embedding is still missing.
   *
   * @param resourceId the owning resource
   * @return number of chunks with a null embedding
   */
  @Query(
      value =
          """
            SELECT COUNT(*) FROM resource_chunks
            WHERE resource_id = :resourceId AND embedding IS NULL
            """,
      nativeQuery = true)
  long countPendingEmbeddings(@Param("resourceId") UUID resourceId);
}
