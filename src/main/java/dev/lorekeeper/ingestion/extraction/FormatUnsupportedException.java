package dev.lorekeeper.ingestion.extraction;

/** The file extension is not one the extractor can read. */
public class FormatUnsupportedException extends ExtractionException {

  private final String extension;

  public FormatUnsupportedException(String extension, String message) {
    super(message);
    this.extension = extension;
  }

  public String getExtension() {
    return extension;
  }
}
