package dev.lorekeeper.embedding;

/** The provider signalled a rate limit (HTTP 429). Retried with exponential backoff. */
public class ProviderRateLimitedException extends EmbeddingProviderException {

  public ProviderRateLimitedException(String message, Throwable cause) {
    super(message, cause);
  }
}
