package dev.lorekeeper.querylog;

/** A completed query could not be persisted; the answer must not be returned. */
public class QueryLoggingException extends RuntimeException {

  public QueryLoggingException(String message, Throwable cause) {
    super(message, cause);
  }
}
