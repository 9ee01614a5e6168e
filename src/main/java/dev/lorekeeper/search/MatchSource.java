package dev.lorekeeper.search;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Which ranked list(s) a search result came from. */
public enum MatchSource {
  VECTOR,
  KEYWORD,
  /** Present in both the vector and the keyword list. */
  HYBRID;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
