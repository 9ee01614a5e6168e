package dev.lorekeeper.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text on {@code .}, {@code !} or {@code ?} followed by whitespace.
 *
 * <p>Common abbreviations ({@code Dr.}, {@code Mr.}, {@code Mrs.}, {@code Ms.}, {@code Jr.},
 * {@code Sr.}, {@code vs.}, {@code e.g.}, {@code i.e.}, {@code etc.}) never end a sentence. They
 * are masked in a same-length copy of the input, so boundaries found in the copy are valid offsets
 * into the original and sentence text is always sliced from the original.
 */
public final class SentenceSplitter {

  private static final Pattern ABBREVIATIONS =
      Pattern.compile("Dr\\.|Mrs\\.|Mr\\.|Ms\\.|Jr\\.|Sr\\.|vs\\.|e\\.g\\.|i\\.e\\.|etc\\.");
  private static final Pattern BOUNDARY = Pattern.compile("[.!?]+\\s+");
  private static final char MASK = '\uE000';

  private SentenceSplitter() {}

  /**
   * Splits text into trimmed sentences. Trailing unterminated text becomes the last sentence.
   *
   * @param text the text to split
   * @return sentences in order, never blank
   */
  public static List<String> splitOnSentences(String text) {
    return sentenceSpans(text).stream().map(span -> span.of(text)).toList();
  }

  /**
   * Returns the trimmed sentence ranges of the text.
   *
   * @param text the text to split
   * @return non-empty spans in order, relative to {@code text}
   */
  public static List<TextSpan> sentenceSpans(String text) {
    String masked = mask(text);
    List<TextSpan> spans = new ArrayList<>();
    Matcher boundary = BOUNDARY.matcher(masked);
    int from = 0;
    while (boundary.find()) {
      addTrimmed(spans, text, from, boundary.end());
      from = boundary.end();
    }
    addTrimmed(spans, text, from, text.length());
    return spans;
  }

  private static String mask(String text) {
    char[] chars = text.toCharArray();
    Matcher abbreviation = ABBREVIATIONS.matcher(text);
    while (abbreviation.find()) {
      for (int i = abbreviation.start(); i < abbreviation.end(); i++) {
        if (chars[i] == '.') {
          chars[i] = MASK;
        }
      }
    }
    return new String(chars);
  }

  private static void addTrimmed(List<TextSpan> spans, String text, int start, int end) {
    while (start < end && Character.isWhitespace(text.charAt(start))) {
      start++;
    }
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    if (start < end) {
      spans.add(new TextSpan(start, end));
    }
  }
}
