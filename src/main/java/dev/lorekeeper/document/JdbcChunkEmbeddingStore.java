package dev.lorekeeper.document;

import com.pgvector.PGvector;
import dev.lorekeeper.resource.ResourceStatus;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link ChunkEmbeddingStore} over plain JDBC. The vector column is not JPA-mapped, so updates go
 * through {@link JdbcTemplate} with the vector bound as a {@link PGvector}.
 */
@Repository
public class JdbcChunkEmbeddingStore implements ChunkEmbeddingStore {

  private static final String UPDATE_IF_NULL =
      """
      UPDATE resource_chunks
      SET embedding = ?
      WHERE id = ? AND embedding IS NULL
      """;

  private final JdbcTemplate jdbcTemplate;
  private final NamedParameterJdbcTemplate namedJdbcTemplate;

  public JdbcChunkEmbeddingStore(
      JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.namedJdbcTemplate = namedJdbcTemplate;
  }

  @Override
  @Transactional(readOnly = true)
  public List<PendingChunk> findPendingChunks(UUID resourceId) {
    return jdbcTemplate.query(
        """
        SELECT id, chunk_index, raw_text
        FROM resource_chunks
        WHERE resource_id = ? AND embedding IS NULL
        ORDER BY chunk_index
        """,
        (rs, rowNum) ->
            new PendingChunk(
                rs.getObject("id", UUID.class), rs.getInt("chunk_index"), rs.getString("raw_text")),
        resourceId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<UUID> findResourcesWithPendingChunks(
      @Nullable UUID resourceId, @Nullable UUID collectionId) {
    StringBuilder sql =
        new StringBuilder(
            """
            SELECT r.id
            FROM resources r
            WHERE r.ingestion_status IN (:finished)
              AND EXISTS (
                SELECT 1 FROM resource_chunks c
                WHERE c.resource_id = r.id AND c.embedding IS NULL)
            """);
    MapSqlParameterSource params =
        new MapSqlParameterSource(
            "finished",
            List.of(
                ResourceStatus.COMPLETED.name(), ResourceStatus.COMPLETED_NO_EMBEDDINGS.name()));
    if (resourceId != null) {
      sql.append(" AND r.id = :resourceId");
      params.addValue("resourceId", resourceId);
    }
    if (collectionId != null) {
      sql.append(" AND r.collection_id = :collectionId");
      params.addValue("collectionId", collectionId);
    }
    sql.append(" ORDER BY r.uploaded_at ASC");
    return namedJdbcTemplate.queryForList(sql.toString(), params, UUID.class);
  }

  @Override
  @Transactional
  public int writeBatch(List<ChunkVector> vectors) {
    if (vectors.isEmpty()) {
      return 0;
    }
    int[] updated =
        jdbcTemplate.batchUpdate(
            UPDATE_IF_NULL,
            new BatchPreparedStatementSetter() {
              @Override
              public void setValues(PreparedStatement ps, int i) throws SQLException {
                ChunkVector vector = vectors.get(i);
                ps.setObject(1, new PGvector(vector.embedding().vector()));
                ps.setObject(2, vector.chunkId());
              }

              @Override
              public int getBatchSize() {
                return vectors.size();
              }
            });
    int total = 0;
    for (int count : updated) {
      // the driver may report SUCCESS_NO_INFO (-2) for batched statements
      total += count < 0 ? 1 : count;
    }
    return total;
  }
}
