package dev.lorekeeper.querylog;

import java.util.UUID;

/** Thrown when feedback targets a query id that was never logged. */
public class QueryLogNotFoundException extends RuntimeException {

  private final UUID queryId;

  public QueryLogNotFoundException(UUID queryId) {
    super("Query not found: " + queryId);
    this.queryId = queryId;
  }

  public UUID getQueryId() {
    return queryId;
  }
}
