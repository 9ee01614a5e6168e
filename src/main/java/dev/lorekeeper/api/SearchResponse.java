package dev.lorekeeper.api;

import dev.lorekeeper.search.ScoredChunk;
import java.util.List;

/** Ranked chunks returned by the search endpoint. */
public record SearchResponse(List<ScoredChunk> results, int count) {

  static SearchResponse of(List<ScoredChunk> results) {
    return new SearchResponse(results, results.size());
  }
}
