package dev.lorekeeper.resource;

import java.util.UUID;

/** Thrown when a resource id does not exist. */
public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(UUID resourceId) {
    super("Resource not found: " + resourceId);
  }
}
