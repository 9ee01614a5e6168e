package dev.lorekeeper.embedding;

/** Every retry of a rate-limited embedding call was used up. */
public class EmbeddingProviderExhaustedException extends EmbeddingProviderException {

  private final int attempts;

  public EmbeddingProviderExhaustedException(int attempts, Throwable cause) {
    super("Embedding provider still rate limited after " + attempts + " attempts", cause);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
