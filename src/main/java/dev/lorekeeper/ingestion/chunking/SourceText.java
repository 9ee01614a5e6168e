package dev.lorekeeper.ingestion.chunking;

import dev.lorekeeper.ingestion.extraction.ExtractedPage;
import java.util.Arrays;
import java.util.List;

/**
 * The assembled document text that every chunk offset refers to. Never modified after assembly.
 *
 * <p>Pages are concatenated as {@code page.text + "\n\n"}; the offset at which each page starts is
 * recorded so any offset can be mapped back to its page.
 */
final class SourceText {

  private static final String PAGE_SEPARATOR = "\n\n";

  private final String text;
  private final int[] pageStarts;
  private final int[] pageNumbers;
  private final List<String> lines;
  private final int[] lineStarts;

  private SourceText(String text, int[] pageStarts, int[] pageNumbers) {
    this.text = text;
    this.pageStarts = pageStarts;
    this.pageNumbers = pageNumbers;
    this.lines = Arrays.asList(text.split("\n", -1));
    this.lineStarts = new int[lines.size()];
    int offset = 0;
    for (int i = 0; i < lines.size(); i++) {
      lineStarts[i] = offset;
      offset += lines.get(i).length() + 1;
    }
  }

  static SourceText of(List<ExtractedPage> pages) {
    StringBuilder builder = new StringBuilder();
    int[] starts = new int[pages.size()];
    int[] numbers = new int[pages.size()];
    for (int i = 0; i < pages.size(); i++) {
      starts[i] = builder.length();
      numbers[i] = pages.get(i).pageNumber();
      builder.append(pages.get(i).text()).append(PAGE_SEPARATOR);
    }
    return new SourceText(builder.toString(), starts, numbers);
  }

  String text() {
    return text;
  }

  int length() {
    return text.length();
  }

  String slice(int start, int end) {
    return text.substring(start, end);
  }

  List<String> lines() {
    return lines;
  }

  int lineStart(int line) {
    return lineStarts[line];
  }

  /** Offset just past the last character of the line, excluding the newline. */
  int lineEnd(int line) {
    return lineStarts[line] + lines.get(line).length();
  }

  /** Page containing the offset: the last page starting at or before it, or 1. */
  int pageAt(int offset) {
    for (int i = pageStarts.length - 1; i >= 0; i--) {
      if (offset >= pageStarts[i]) {
        return pageNumbers[i];
      }
    }
    return 1;
  }

  /** Narrows a range to exclude leading and trailing whitespace; may return an empty span. */
  TextSpan trim(int start, int end) {
    while (start < end && Character.isWhitespace(text.charAt(start))) {
      start++;
    }
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    return new TextSpan(start, end);
  }
}
