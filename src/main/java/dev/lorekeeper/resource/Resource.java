package dev.lorekeeper.resource;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * An uploaded document owned by a collection.
 *
 * <p>Created on upload and mutated only by the ingestion pipeline. The lifecycle follows {@link
 * ResourceStatus}. Free-form processing details (embedding usage, failure stage, document
 * properties) are kept in the JSONB {@code metadata} column; keys are overwritten, never
 * accumulated, so a redelivered job leaves the same values behind.
 *
 * <p>Maps to the {@code resources} table managed by Flyway migrations.
 *
 * @see ResourceRepository
 */
@Entity
@Table(name = "resources")
public class Resource {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "collection_id", nullable = false)
  private UUID collectionId;

  @Column(name = "original_filename", nullable = false)
  private String originalFilename;

  @Column(name = "file_url", nullable = false)
  private String fileUrl;

  private String title;

  private String author;

  @Enumerated(EnumType.STRING)
  @Column(name = "ingestion_status", nullable = false)
  private ResourceStatus status = ResourceStatus.PENDING;

  @Column(name = "ingestion_error", columnDefinition = "TEXT")
  private String ingestionError;

  @Column(name = "total_pages")
  private Integer totalPages;

  @Column(name = "total_chunks")
  private Integer totalChunks;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB", nullable = false)
  private Map<String, Object> metadata = new HashMap<>();

  @Column(name = "processing_started_at")
  private Instant processingStartedAt;

  @Column(name = "processing_completed_at")
  private Instant processingCompletedAt;

  @Column(name = "processing_duration_ms")
  private Long processingDurationMs;

  @Column(name = "processing_attempts", nullable = false)
  private int processingAttempts;

  @Column(name = "uploaded_at", nullable = false, updatable = false)
  private Instant uploadedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Resource() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a new resource in {@link ResourceStatus#PENDING} state.
   *
   * @param collectionId the owning collection
   * @param originalFilename the filename as uploaded, used for display and citations
   * @param fileUrl location of the stored file, relative to the upload directory
   */
  public Resource(UUID collectionId, String originalFilename, String fileUrl) {
    this.collectionId = collectionId;
    this.originalFilename = originalFilename;
    this.fileUrl = fileUrl;
  }

  @PrePersist
  protected void onCreate() {
    this.uploadedAt = Instant.now();
    this.updatedAt = this.uploadedAt;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  /**
   * Enters {@link ResourceStatus#PROCESSING}. Re-entering from {@code PROCESSING} keeps the
   * original start time so a redelivered job does not reset the clock.
   *
   * @param now the current instant
   */
  public void startProcessing(Instant now) {
    if (status != ResourceStatus.PROCESSING || processingStartedAt == null) {
      this.processingStartedAt = now;
    }
    this.status = ResourceStatus.PROCESSING;
    this.ingestionError = null;
    this.processingAttempts++;
  }

  /**
   * Records a terminal state together with the completion time and elapsed duration.
   *
   * @param terminal {@code COMPLETED}, {@code COMPLETED_NO_EMBEDDINGS} or {@code FAILED}
   * @param now the current instant
   */
  public void finishProcessing(ResourceStatus terminal, Instant now) {
    this.status = terminal;
    this.processingCompletedAt = now;
    if (processingStartedAt != null) {
      this.processingDurationMs = now.toEpochMilli() - processingStartedAt.toEpochMilli();
    }
  }

  /** Overwrites the given metadata keys, keeping all others. */
  public void putMetadata(Map<String, ?> values) {
    Map<String, Object> merged = new HashMap<>(metadata);
    merged.putAll(values);
    this.metadata = merged;
  }

  /** Removes the given metadata keys if present. */
  public void removeMetadata(String... keys) {
    Map<String, Object> pruned = new HashMap<>(metadata);
    for (String key : keys) {
      pruned.remove(key);
    }
    this.metadata = pruned;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCollectionId() {
    return collectionId;
  }

  public String getOriginalFilename() {
    return originalFilename;
  }

  public String getFileUrl() {
    return fileUrl;
  }

  public @Nullable String getTitle() {
    return title;
  }

  public void setTitle(@Nullable String title) {
    this.title = title;
  }

  public @Nullable String getAuthor() {
    return author;
  }

  public void setAuthor(@Nullable String author) {
    this.author = author;
  }

  public ResourceStatus getStatus() {
    return status;
  }

  public void setStatus(ResourceStatus status) {
    this.status = status;
  }

  public @Nullable String getIngestionError() {
    return ingestionError;
  }

  public void setIngestionError(@Nullable String ingestionError) {
    this.ingestionError = ingestionError;
  }

  public @Nullable Integer getTotalPages() {
    return totalPages;
  }

  public void setTotalPages(@Nullable Integer totalPages) {
    this.totalPages = totalPages;
  }

  public @Nullable Integer getTotalChunks() {
    return totalChunks;
  }

  public void setTotalChunks(@Nullable Integer totalChunks) {
    this.totalChunks = totalChunks;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public @Nullable Instant getProcessingStartedAt() {
    return processingStartedAt;
  }

  public @Nullable Instant getProcessingCompletedAt() {
    return processingCompletedAt;
  }

  public @Nullable Long getProcessingDurationMs() {
    return processingDurationMs;
  }

  public int getProcessingAttempts() {
    return processingAttempts;
  }

  public Instant getUploadedAt() {
    return uploadedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
