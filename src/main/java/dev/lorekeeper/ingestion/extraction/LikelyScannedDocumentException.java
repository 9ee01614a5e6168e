package dev.lorekeeper.ingestion.extraction;

/** A multi-page PDF yielded almost no text, so it is most likely a scan. OCR is not supported. */
public class LikelyScannedDocumentException extends ExtractionException {

  public LikelyScannedDocumentException(String message) {
    super(message);
  }
}
