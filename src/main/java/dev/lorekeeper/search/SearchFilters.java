package dev.lorekeeper.search;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Optional restrictions applied to both vector and keyword search. Empty lists mean no filter.
 *
 * @param resourceIds only chunks of these resources
 * @param pageNumbers only chunks starting on these pages
 * @param tags only chunks carrying at least one of these tags
 */
public record SearchFilters(List<UUID> resourceIds, List<Integer> pageNumbers, List<String> tags) {

  public static final SearchFilters NONE = new SearchFilters(List.of(), List.of(), List.of());

  public SearchFilters(
      @Nullable List<UUID> resourceIds,
      @Nullable List<Integer> pageNumbers,
      @Nullable List<String> tags) {
    this.resourceIds = resourceIds == null ? List.of() : List.copyOf(resourceIds);
    this.pageNumbers = pageNumbers == null ? List.of() : List.copyOf(pageNumbers);
    this.tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static SearchFilters resources(@Nullable List<UUID> resourceIds) {
    return new SearchFilters(resourceIds, null, null);
  }
}
