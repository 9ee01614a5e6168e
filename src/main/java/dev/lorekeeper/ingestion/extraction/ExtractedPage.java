package dev.lorekeeper.ingestion.extraction;

/**
 * One page of extracted plain text.
 *
 * @param pageNumber 1-based page number
 * @param text the page text, trimmed
 * @param hasImages whether the page carried embedded images (flagged only, never extracted)
 * @param hasTables whether a table-like region was detected in the text
 */
public record ExtractedPage(int pageNumber, String text, boolean hasImages, boolean hasTables) {}
