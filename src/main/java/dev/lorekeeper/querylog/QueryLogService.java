package dev.lorekeeper.querylog;

import java.time.Clock;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists answered queries and their later feedback.
 *
 * <p>{@link #log} flushes and commits before returning, so a caller that gets an id back knows the
 * row is durable. Any persistence failure surfaces as {@link QueryLoggingException}.
 */
@Service
public class QueryLogService {

  private static final Logger log = LoggerFactory.getLogger(QueryLogService.class);

  private final QueryLogRepository repository;
  private final Clock clock;

  public QueryLogService(QueryLogRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  /**
   * Writes the query log row.
   *
   * @param entry the completed query
   * @return the generated query id
   * @throws QueryLoggingException if the row could not be written
   */
  public UUID log(QueryLogEntry entry) {
    try {
      QueryLog saved = repository.saveAndFlush(new QueryLog(entry));
      log.info(
          "Logged query {} for collection {} ({} chunks)",
          saved.getId(),
          entry.collectionId(),
          entry.chunkIds().size());
      return saved.getId();
    } catch (DataAccessException | TransactionException e) {
      log.error("Failed to log query for collection {}", entry.collectionId(), e);
      throw new QueryLoggingException("Failed to log query: " + e.getMessage(), e);
    }
  }

  /**
   * Stores a rating and optional comment on a logged query, replacing earlier feedback.
   *
   * @param queryId the logged query
   * @param rating 1 (poor) to 5 (excellent)
   * @param comment optional free text
   * @throws QueryLogNotFoundException if no such query was logged
   */
  @Transactional
  public void recordFeedback(UUID queryId, int rating, @Nullable String comment) {
    if (rating < 1 || rating > 5) {
      throw new IllegalArgumentException("rating must be between 1 and 5, got: " + rating);
    }
    QueryLog queryLog =
        repository.findById(queryId).orElseThrow(() -> new QueryLogNotFoundException(queryId));
    queryLog.recordFeedback(rating, comment, clock.instant());
    log.debug("Recorded feedback {} for query {}", rating, queryId);
  }
}
