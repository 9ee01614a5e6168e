package dev.lorekeeper.search;

import com.pgvector.PGvector;
import dev.lorekeeper.resource.ResourceStatus;
import dev.langchain4j.data.embedding.Embedding;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Native retrieval queries over {@code resource_chunks}. Both queries are restricted to chunks of
 * searchable resources in one collection and honour the optional {@link SearchFilters}.
 *
 * <p>Vector search ranks by pgvector cosine distance and reports {@code 1 - distance}; keyword
 * search ranks with {@code ts_rank} over the English text-search configuration.
 */
@Repository
public class ChunkSearchRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT c.id, c.resource_id, c.raw_text, c.page_number, c.section_heading,
             r.original_filename,
      """;

  private static final String FROM_SEARCHABLE =
      """
      FROM resource_chunks c
      JOIN resources r ON r.id = c.resource_id
      WHERE r.collection_id = :collectionId
        AND r.ingestion_status IN (:statuses)
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ChunkSearchRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /**
   * Returns up to {@code limit} embedded chunks nearest to the query vector, best first.
   *
   * @param collectionId collection to search
   * @param queryEmbedding embedding of the query text
   * @param limit maximum number of rows
   * @param filters optional restrictions
   */
  @Transactional(readOnly = true)
  public List<ScoredChunk> vectorSearch(
      UUID collectionId, Embedding queryEmbedding, int limit, SearchFilters filters) {
    MapSqlParameterSource params = baseParams(collectionId, limit);
    params.addValue("embedding", new PGvector(queryEmbedding.vector()));
    String sql =
        SELECT_COLUMNS
            + "       1 - (c.embedding <=> :embedding) AS score\n"
            + FROM_SEARCHABLE
            + "  AND c.embedding IS NOT NULL\n"
            + filterClauses(filters, params)
            + "ORDER BY c.embedding <=> :embedding, c.id\n"
            + "LIMIT :limit";
    return jdbcTemplate.query(sql, params, rowMapper(MatchSource.VECTOR));
  }

  /**
   * Returns up to {@code limit} chunks matching the query terms, ordered by text rank.
   *
   * @param collectionId collection to search
   * @param query free-text query, parsed with {@code plainto_tsquery}
   * @param limit maximum number of rows
   * @param filters optional restrictions
   */
  @Transactional(readOnly = true)
  public List<ScoredChunk> keywordSearch(
      UUID collectionId, String query, int limit, SearchFilters filters) {
    MapSqlParameterSource params = baseParams(collectionId, limit);
    params.addValue("query", query);
    String sql =
        SELECT_COLUMNS
            + "       ts_rank(to_tsvector('english', c.raw_text),"
            + " plainto_tsquery('english', :query)) AS score\n"
            + FROM_SEARCHABLE
            + "  AND to_tsvector('english', c.raw_text) @@ plainto_tsquery('english', :query)\n"
            + filterClauses(filters, params)
            + "ORDER BY score DESC, c.id\n"
            + "LIMIT :limit";
    return jdbcTemplate.query(sql, params, rowMapper(MatchSource.KEYWORD));
  }

  private static MapSqlParameterSource baseParams(UUID collectionId, int limit) {
    return new MapSqlParameterSource()
        .addValue("collectionId", collectionId)
        .addValue(
            "statuses",
            List.of(ResourceStatus.COMPLETED.name(), ResourceStatus.COMPLETED_NO_EMBEDDINGS.name()))
        .addValue("limit", limit);
  }

  private static String filterClauses(SearchFilters filters, MapSqlParameterSource params) {
    StringBuilder clauses = new StringBuilder();
    if (!filters.resourceIds().isEmpty()) {
      clauses.append("  AND c.resource_id IN (:resourceIds)\n");
      params.addValue("resourceIds", filters.resourceIds());
    }
    if (!filters.pageNumbers().isEmpty()) {
      clauses.append("  AND c.page_number IN (:pageNumbers)\n");
      params.addValue("pageNumbers", filters.pageNumbers());
    }
    if (!filters.tags().isEmpty()) {
      clauses.append("  AND c.tags && ARRAY[:tags]::text[]\n");
      params.addValue("tags", filters.tags());
    }
    return clauses.toString();
  }

  private static RowMapper<ScoredChunk> rowMapper(MatchSource source) {
    return (ResultSet rs, int rowNum) -> map(rs, source);
  }

  private static ScoredChunk map(ResultSet rs, MatchSource source) throws SQLException {
    return new ScoredChunk(
        rs.getObject("id", UUID.class),
        rs.getObject("resource_id", UUID.class),
        rs.getString("raw_text"),
        (Integer) rs.getObject("page_number"),
        rs.getString("section_heading"),
        rs.getString("original_filename"),
        rs.getDouble("score"),
        source);
  }
}
