package dev.lorekeeper.ingestion.chunking;

/**
 * A heading-delimited region of the document text.
 *
 * @param heading the heading text with any markdown {@code #} prefix removed
 * @param startLine index of the heading line
 * @param endLine index of the last line belonging to this section (inclusive)
 * @param level heading level, 1 being the top
 */
public record Section(String heading, int startLine, int endLine, int level) {}
