package dev.lorekeeper.search;

/** Which retrieval strategy a search uses. */
public enum SearchMode {
  /** Cosine similarity over chunk embeddings only. */
  VECTOR,
  /** Postgres full-text ranking only. */
  KEYWORD,
  /** Both, run in parallel and fused with reciprocal-rank fusion. */
  HYBRID
}
