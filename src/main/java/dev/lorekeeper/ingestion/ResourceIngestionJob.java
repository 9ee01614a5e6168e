package dev.lorekeeper.ingestion;

import java.util.Objects;
import java.util.UUID;

/**
 * A request to run the ingestion pipeline for one resource.
 *
 * @param resourceId the resource to process
 * @param collectionId the collection owning the resource
 * @param filePath stored file location, resolved through the file store
 */
public record ResourceIngestionJob(UUID resourceId, UUID collectionId, String filePath) {

  public ResourceIngestionJob {
    Objects.requireNonNull(resourceId, "resourceId");
    Objects.requireNonNull(collectionId, "collectionId");
    Objects.requireNonNull(filePath, "filePath");
  }
}
