package dev.lorekeeper.ingestion.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;
import java.util.regex.Pattern;

/**
 * Detects heading-delimited sections with line heuristics.
 *
 * <p>Each non-blank line of at least four characters is tested against an ordered list of heading
 * rules; the first rule that matches decides the heading level and later rules are not consulted:
 *
 * <ol>
 *   <li>all-caps line shorter than 80 characters (level 1)
 *   <li>numbered heading {@code N.}, {@code N.N}, {@code N.N.N} (levels 1, 2, 3)
 *   <li>markdown {@code #} heading (level = number of {@code #})
 *   <li>capitalised line of 10-59 characters without terminal punctuation, preceded by a blank line
 *       and followed by a non-blank one (level 2)
 *   <li>line of 5-59 characters ending in a colon (level 2)
 * </ol>
 *
 * <p>Each section ends on the line before the next heading; the last runs to the end of the text.
 */
public final class SectionDetector {

  private static final int MIN_LINE_LENGTH = 4;

  private static final Pattern ALL_CAPS = Pattern.compile("^[A-Z\\s0-9]{5,}$");
  private static final Pattern NUMBERED_1 = Pattern.compile("^\\d+\\.\\s+\\w.*");
  private static final Pattern NUMBERED_2 = Pattern.compile("^\\d+\\.\\d+\\s+\\w.*");
  private static final Pattern NUMBERED_3 = Pattern.compile("^\\d+\\.\\d+\\.\\d+\\s+\\w.*");
  private static final Pattern MARKDOWN = Pattern.compile("^(#+)\\s.*");
  private static final Pattern MARKDOWN_PREFIX = Pattern.compile("^#+\\s");
  private static final Pattern TERMINAL_PUNCTUATION = Pattern.compile(".*[.!?]$");

  private static final List<HeadingRule> RULES =
      List.of(
          HeadingRule.fixed(
              "all-caps", line -> ALL_CAPS.matcher(line.text()).matches() && line.length() < 80, 1),
          HeadingRule.fixed("numbered", line -> NUMBERED_1.matcher(line.text()).matches(), 1),
          HeadingRule.fixed("numbered", line -> NUMBERED_2.matcher(line.text()).matches(), 2),
          HeadingRule.fixed("numbered", line -> NUMBERED_3.matcher(line.text()).matches(), 3),
          new HeadingRule(
              "markdown",
              line -> MARKDOWN.matcher(line.text()).matches(),
              line -> leadingHashes(line.text())),
          HeadingRule.fixed(
              "short-line",
              line ->
                  line.length() >= 10
                      && line.length() < 60
                      && line.previous().isEmpty()
                      && !line.next().isEmpty()
                      && startsWithCapital(line.text())
                      && !TERMINAL_PUNCTUATION.matcher(line.text()).matches(),
              2),
          HeadingRule.fixed(
              "colon",
              line -> line.text().endsWith(":") && line.length() >= 5 && line.length() < 60,
              2));

  private SectionDetector() {}

  /**
   * Detects sections in the given text, split on {@code \n}.
   *
   * @param text the full document text
   * @return ordered, non-overlapping sections; empty when no heading was found
   */
  public static List<Section> detectSections(String text) {
    return detectSections(Arrays.asList(text.split("\n", -1)));
  }

  /**
   * Detects sections over pre-split lines. Line indices in the result refer to this list.
   *
   * @param lines the document lines, untrimmed
   * @return ordered, non-overlapping sections; empty when no heading was found
   */
  public static List<Section> detectSections(List<String> lines) {
    List<Integer> starts = new ArrayList<>();
    List<String> headings = new ArrayList<>();
    List<Integer> levels = new ArrayList<>();

    for (int i = 0; i < lines.size(); i++) {
      String text = lines.get(i).trim();
      if (text.length() < MIN_LINE_LENGTH) {
        continue;
      }
      String previous = i > 0 ? lines.get(i - 1).trim() : "";
      String next = i < lines.size() - 1 ? lines.get(i + 1).trim() : "";
      Line line = new Line(text, previous, next);

      for (HeadingRule rule : RULES) {
        if (rule.matches().test(line)) {
          starts.add(i);
          headings.add(MARKDOWN_PREFIX.matcher(text).replaceFirst(""));
          levels.add(rule.level().applyAsInt(line));
          break;
        }
      }
    }

    List<Section> sections = new ArrayList<>(starts.size());
    for (int s = 0; s < starts.size(); s++) {
      int end = s < starts.size() - 1 ? starts.get(s + 1) - 1 : lines.size() - 1;
      sections.add(new Section(headings.get(s), starts.get(s), end, levels.get(s)));
    }
    return sections;
  }

  private static boolean startsWithCapital(String text) {
    char first = text.charAt(0);
    return first >= 'A' && first <= 'Z';
  }

  private static int leadingHashes(String text) {
    int count = 0;
    while (count < text.length() && text.charAt(count) == '#') {
      count++;
    }
    return count;
  }

  /** A trimmed line with its trimmed neighbours. */
  record Line(String text, String previous, String next) {
    int length() {
      return text.length();
    }
  }

  /** One heading heuristic and the level it assigns. */
  record HeadingRule(String name, Predicate<Line> matches, ToIntFunction<Line> level) {
    static HeadingRule fixed(String name, Predicate<Line> matches, int level) {
      return new HeadingRule(name, matches, line -> level);
    }
  }
}
