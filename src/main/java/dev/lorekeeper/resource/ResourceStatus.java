package dev.lorekeeper.resource;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Ingestion lifecycle states for a {@link Resource}.
 *
 * <p>Normal flow: {@code PENDING → PROCESSING → COMPLETED}. An embedding failure after chunks are
 * stored ends in {@code COMPLETED_NO_EMBEDDINGS}, which the backfill pass later moves to {@code
 * COMPLETED}. Extraction and chunking failures end in {@code FAILED}.
 */
public enum ResourceStatus {
  /** Uploaded, waiting for a worker. */
  PENDING,
  /** A worker is running the pipeline for this resource. */
  PROCESSING,
  /** Chunks stored and every chunk has an embedding. */
  COMPLETED,
  /** Chunks stored, embeddings missing; recoverable through backfill. */
  COMPLETED_NO_EMBEDDINGS,
  /** Extraction or chunking failed; see the ingestion error. */
  FAILED;

  /** Chunks of resources in these states are visible to search. */
  public boolean isSearchable() {
    return this == COMPLETED || this == COMPLETED_NO_EMBEDDINGS;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
