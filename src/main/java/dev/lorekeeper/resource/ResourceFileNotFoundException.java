package dev.lorekeeper.resource;

/** Thrown when an uploaded file cannot be located in the file store. */
public class ResourceFileNotFoundException extends RuntimeException {

  public ResourceFileNotFoundException(String message) {
    super(message);
  }
}
