package dev.lorekeeper.ingestion.extraction;

/** The document is encrypted and cannot be opened without a password. */
public class PasswordProtectedException extends ExtractionException {

  public PasswordProtectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
