package dev.lorekeeper.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * A stored chunk of an uploaded resource.
 *
 * <p>Owned by exactly one {@link dev.lorekeeper.resource.Resource} and ordered by {@code
 * chunkIndex}. The {@code embedding vector(1536)} column is not mapped here: it starts out null
 * and is written only through {@link ChunkEmbeddingStore}, whose updates are guarded by {@code
 * embedding IS NULL}.
 *
 * <p>Maps to the {@code resource_chunks} table managed by Flyway migrations.
 *
 * @see ResourceChunkRepository
 */
@Entity
@Table(name = "resource_chunks")
public class ResourceChunk {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "resource_id", nullable = false, updatable = false)
  private UUID resourceId;

  @Column(name = "chunk_index", nullable = false)
  private int chunkIndex;

  @Column(name = "page_number")
  private Integer pageNumber;

  @Column(name = "raw_text", nullable = false, columnDefinition = "TEXT")
  private String rawText;

  @Column(name = "token_count", nullable = false)
  private int tokenCount;

  @Column(name = "section_heading")
  private String sectionHeading;

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(columnDefinition = "TEXT[]", nullable = false)
  private String[] tags = new String[0];

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB", nullable = false)
  private Map<String, Object> metadata = new HashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ResourceChunk() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a chunk without an embedding.
   *
   * @param resourceId the owning resource
   * @param chunkIndex position of the chunk within the resource, starting at 0
   * @param pageNumber page on which the chunk starts
   * @param rawText the chunk text
   * @param tokenCount subword token count of the chunk
   * @param sectionHeading heading of the originating section, or {@code null}
   * @param metadata extra chunk-level details such as source offsets
   */
  public ResourceChunk(
      UUID resourceId,
      int chunkIndex,
      @Nullable Integer pageNumber,
      String rawText,
      int tokenCount,
      @Nullable String sectionHeading,
      Map<String, Object> metadata) {
    this.resourceId = resourceId;
    this.chunkIndex = chunkIndex;
    this.pageNumber = pageNumber;
    this.rawText = rawText;
    this.tokenCount = tokenCount;
    this.sectionHeading = sectionHeading;
    this.metadata = new HashMap<>(metadata);
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  public int getChunkIndex() {
    return chunkIndex;
  }

  public @Nullable Integer getPageNumber() {
    return pageNumber;
  }

  public String getRawText() {
    return rawText;
  }

  public int getTokenCount() {
    return tokenCount;
  }

  public @Nullable String getSectionHeading() {
    return sectionHeading;
  }

  public String[] getTags() {
    return tags.clone();
  }

  public void setTags(String[] tags) {
    this.tags = tags.clone();
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
