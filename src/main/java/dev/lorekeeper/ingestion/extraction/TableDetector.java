package dev.lorekeeper.ingestion.extraction;

import java.util.regex.Pattern;

/**
 * Flags table-like regions in extracted text: three or more consecutive lines that each contain a
 * tab or a run of at least three whitespace characters.
 */
public final class TableDetector {

  private static final Pattern COLUMN_GAP = Pattern.compile("\\t|\\s{3,}");
  private static final int MIN_CONSECUTIVE_LINES = 3;

  private TableDetector() {}

  public static boolean containsTable(String text) {
    int consecutive = 0;
    for (String line : text.split("\n", -1)) {
      if (COLUMN_GAP.matcher(line).find()) {
        consecutive++;
        if (consecutive >= MIN_CONSECUTIVE_LINES) {
          return true;
        }
      } else {
        consecutive = 0;
      }
    }
    return false;
  }
}
