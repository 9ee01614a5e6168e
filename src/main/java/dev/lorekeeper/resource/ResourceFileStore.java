package dev.lorekeeper.resource;

import java.nio.file.Path;

/**
 * Read-only access to uploaded files. The ingestion pipeline never deletes or rewrites the
 * original upload.
 */
public interface ResourceFileStore {

  /**
   * Resolves a stored file location to a readable path.
   *
   * @param fileUrl the location recorded on the resource or carried by the job
   * @return an absolute path to an existing regular file
   * @throws ResourceFileNotFoundException if the location is outside the store or does not exist
   */
  Path resolve(String fileUrl);
}
