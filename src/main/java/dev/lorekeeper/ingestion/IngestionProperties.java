package dev.lorekeeper.ingestion;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the ingestion worker pool.
 *
 * <p>Properties are bound from {@code lorekeeper.ingestion.*} in application.yml.
 *
 * <ul>
 *   <li>{@code upload-dir} - directory uploaded files are stored in (default ./uploads)
 *   <li>{@code worker-threads} - number of concurrent jobs (default 5)
 *   <li>{@code queue-capacity} - jobs waiting for a worker before submissions are rejected
 *       (default 100)
 *   <li>{@code supported-extensions} - extensions accepted for processing
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "lorekeeper.ingestion")
public class IngestionProperties {

  private Path uploadDir = Path.of("uploads");
  private int workerThreads = 5;
  private int queueCapacity = 100;
  private List<String> supportedExtensions = List.of("pdf", "docx", "txt", "md");

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (workerThreads < 1) {
      throw new IllegalStateException(
          "lorekeeper.ingestion.worker-threads must be at least 1, got: " + workerThreads);
    }
    if (queueCapacity < 0) {
      throw new IllegalStateException(
          "lorekeeper.ingestion.queue-capacity must not be negative, got: " + queueCapacity);
    }
  }

  public Path getUploadDir() {
    return uploadDir;
  }

  public void setUploadDir(Path uploadDir) {
    this.uploadDir = uploadDir;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  public List<String> getSupportedExtensions() {
    return supportedExtensions;
  }

  public void setSupportedExtensions(List<String> supportedExtensions) {
    this.supportedExtensions = supportedExtensions;
  }
}
