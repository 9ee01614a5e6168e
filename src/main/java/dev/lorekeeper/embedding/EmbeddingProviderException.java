package dev.lorekeeper.embedding;

/**
 * The embedding provider failed. Not retried unless it is a {@link ProviderRateLimitedException}.
 * Fatal to the embedding step only: chunks stay stored and can be completed by backfill.
 */
public class EmbeddingProviderException extends RuntimeException {

  public EmbeddingProviderException(String message) {
    super(message);
  }

  public EmbeddingProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
