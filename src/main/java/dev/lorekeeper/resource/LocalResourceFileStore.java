package dev.lorekeeper.resource;

import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * {@link ResourceFileStore} backed by a local upload directory.
 *
 * <p>Locations are resolved against {@code lorekeeper.ingestion.upload-dir}; anything that
 * normalises to a path outside that directory is rejected.
 */
@Component
public class LocalResourceFileStore implements ResourceFileStore {

  private final Path uploadDir;

  public LocalResourceFileStore(@Value("${lorekeeper.ingestion.upload-dir}") Path uploadDir) {
    this.uploadDir = uploadDir.toAbsolutePath().normalize();
  }

  @Override
  public Path resolve(String fileUrl) {
    Path candidate = uploadDir.resolve(fileUrl).normalize();
    if (!candidate.startsWith(uploadDir)) {
      throw new ResourceFileNotFoundException("File location escapes upload directory: " + fileUrl);
    }
    if (!Files.isRegularFile(candidate)) {
      throw new ResourceFileNotFoundException("Uploaded file not found: " + fileUrl);
    }
    return candidate;
  }
}
