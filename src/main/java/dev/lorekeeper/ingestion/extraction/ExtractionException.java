package dev.lorekeeper.ingestion.extraction;

/** Base type for failures that prevent text extraction. Always fatal to the resource. */
public class ExtractionException extends RuntimeException {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
