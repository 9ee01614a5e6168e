package dev.lorekeeper.ingestion.extraction;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Descriptive properties read from the document itself. All fields are optional. */
public record DocumentMetadata(
    @Nullable String title,
    @Nullable String author,
    @Nullable String subject,
    @Nullable String creator,
    @Nullable String producer) {

  static DocumentMetadata titled(String title) {
    return new DocumentMetadata(title, null, null, null, null);
  }

  /** Returns the non-blank properties other than title and author, keyed for resource metadata. */
  public Map<String, String> extraProperties() {
    Map<String, String> extra = new LinkedHashMap<>();
    putIfPresent(extra, "subject", subject);
    putIfPresent(extra, "creator", creator);
    putIfPresent(extra, "producer", producer);
    return extra;
  }

  private static void putIfPresent(Map<String, String> target, String key, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      target.put(key, value.trim());
    }
  }
}
