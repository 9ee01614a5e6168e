package dev.lorekeeper.answer;

/** The completion provider failed to produce an answer. Fatal to the query. */
public class CompletionProviderException extends RuntimeException {

  public CompletionProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
