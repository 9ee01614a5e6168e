package dev.lorekeeper.ingestion;

import java.util.UUID;

/** A pipeline stage failed fatally; the resource has been marked failed. */
public class IngestionFailedException extends RuntimeException {

  private final UUID resourceId;
  private final IngestionStage stage;

  public IngestionFailedException(UUID resourceId, IngestionStage stage, Throwable cause) {
    super(describe(stage, cause), cause);
    this.resourceId = resourceId;
    this.stage = stage;
  }

  /** Formats a failure as {@code [STAGE] message}, the form stored on the resource. */
  static String describe(IngestionStage stage, Throwable cause) {
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    return "[" + stage + "] " + message;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  public IngestionStage getStage() {
    return stage;
  }
}
