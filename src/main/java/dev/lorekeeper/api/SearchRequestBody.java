package dev.lorekeeper.api;

import dev.lorekeeper.search.SearchFilters;
import dev.lorekeeper.search.SearchMode;
import dev.lorekeeper.search.SearchRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** JSON body of the retrieval-only search endpoint. */
public record SearchRequestBody(
    @NotBlank @Size(max = 500) String query,
    @Nullable @Min(1) @Max(20) Integer topK,
    @Nullable SearchMode mode,
    @Nullable List<UUID> resourceIds,
    @Nullable List<Integer> pageNumbers,
    @Nullable List<String> tags) {

  SearchRequest toSearchRequest(UUID collectionId, int defaultTopK) {
    return new SearchRequest(
        collectionId,
        query,
        topK != null ? topK : defaultTopK,
        mode,
        new SearchFilters(resourceIds, pageNumbers, tags));
  }
}
