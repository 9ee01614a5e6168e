package dev.lorekeeper.ingestion.extraction;

import java.util.List;

/**
 * Output of {@link DocumentExtractor}: ordered pages plus document properties.
 *
 * @param pages pages in reading order, numbered from 1
 * @param totalPages page count reported by the document
 * @param metadata title, author and related properties
 */
public record ExtractionResult(
    List<ExtractedPage> pages, int totalPages, DocumentMetadata metadata) {

  public ExtractionResult {
    pages = List.copyOf(pages);
  }

  /** Total number of characters across all (already trimmed) pages. */
  public int characterCount() {
    return pages.stream().mapToInt(p -> p.text().length()).sum();
  }
}
