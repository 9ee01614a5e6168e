package dev.lorekeeper.querylog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * One answered question: the retrieved chunk ids with their scores, the generated answer and its
 * usage. Rows are written once per completed query; only the feedback columns change afterwards.
 *
 * <p>Maps to the {@code query_logs} table managed by Flyway migrations.
 */
@Entity
@Table(name = "query_logs")
public class QueryLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "collection_id", nullable = false, updatable = false)
  private UUID collectionId;

  @Column(name = "query_text", nullable = false, updatable = false, columnDefinition = "TEXT")
  private String queryText;

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(name = "retrieved_chunk_ids", nullable = false, updatable = false)
  private UUID[] retrievedChunkIds;

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(name = "retrieved_chunk_scores", nullable = false, updatable = false)
  private double[] retrievedChunkScores;

  @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
  private String answer;

  @Column(nullable = false, updatable = false)
  private String model;

  @Column(name = "prompt_tokens", nullable = false, updatable = false)
  private int promptTokens;

  @Column(name = "completion_tokens", nullable = false, updatable = false)
  private int completionTokens;

  @Column(name = "latency_ms", nullable = false, updatable = false)
  private long latencyMs;

  @Column(name = "conversation_id", updatable = false)
  private UUID conversationId;

  @Column(name = "feedback_rating")
  private Integer feedbackRating;

  @Column(name = "feedback_comment", columnDefinition = "TEXT")
  private String feedbackComment;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "feedback_updated_at")
  private Instant feedbackUpdatedAt;

  protected QueryLog() {
    // JPA requires no-arg constructor
  }

  QueryLog(QueryLogEntry entry) {
    this.collectionId = entry.collectionId();
    this.queryText = entry.queryText();
    this.retrievedChunkIds = entry.chunkIds().toArray(new UUID[0]);
    this.retrievedChunkScores =
        entry.chunkScores().stream().mapToDouble(Double::doubleValue).toArray();
    this.answer = entry.answer();
    this.model = entry.model();
    this.promptTokens = entry.promptTokens();
    this.completionTokens = entry.completionTokens();
    this.latencyMs = entry.latencyMs();
    this.conversationId = entry.conversationId();
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
  }

  void recordFeedback(int rating, @Nullable String comment, Instant now) {
    this.feedbackRating = rating;
    this.feedbackComment = comment;
    this.feedbackUpdatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCollectionId() {
    return collectionId;
  }

  public String getQueryText() {
    return queryText;
  }

  public UUID[] getRetrievedChunkIds() {
    return retrievedChunkIds.clone();
  }

  public double[] getRetrievedChunkScores() {
    return retrievedChunkScores.clone();
  }

  public String getAnswer() {
    return answer;
  }

  public String getModel() {
    return model;
  }

  public int getPromptTokens() {
    return promptTokens;
  }

  public int getCompletionTokens() {
    return completionTokens;
  }

  public long getLatencyMs() {
    return latencyMs;
  }

  public @Nullable UUID getConversationId() {
    return conversationId;
  }

  public @Nullable Integer getFeedbackRating() {
    return feedbackRating;
  }

  public @Nullable String getFeedbackComment() {
    return feedbackComment;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public @Nullable Instant getFeedbackUpdatedAt() {
    return feedbackUpdatedAt;
  }
}
