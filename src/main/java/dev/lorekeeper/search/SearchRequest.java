package dev.lorekeeper.search;

import java.util.UUID;

/**
 * A search scoped to one collection.
 *
 * @param collectionId the collection whose resources are searched
 * @param query the search text (must not be blank)
 * @param topK maximum number of results (must be >= 1)
 * @param mode retrieval strategy
 * @param filters optional resource, page and tag restrictions
 */
public record SearchRequest(
    UUID collectionId, String query, int topK, SearchMode mode, SearchFilters filters) {

  /** Compact constructor validating input. */
  public SearchRequest {
    if (collectionId == null) {
      throw new IllegalArgumentException("collectionId must not be null");
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1");
    }
    if (mode == null) {
      mode = SearchMode.HYBRID;
    }
    if (filters == null) {
      filters = SearchFilters.NONE;
    }
  }

  /** Convenience constructor for an unfiltered hybrid search. */
  public SearchRequest(UUID collectionId, String query, int topK) {
    this(collectionId, query, topK, SearchMode.HYBRID, SearchFilters.NONE);
  }
}
