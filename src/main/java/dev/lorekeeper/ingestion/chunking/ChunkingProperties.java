package dev.lorekeeper.ingestion.chunking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for {@link DocumentChunker}.
 *
 * <p>Properties are bound from {@code lorekeeper.chunking.*} in application.yml.
 *
 * <ul>
 *   <li>{@code min-tokens} - chunks below this size are merged into their successor (default 300)
 *   <li>{@code max-tokens} - hard upper bound for every chunk (default 800)
 *   <li>{@code target-tokens} - size of the pieces an over-long sentence is cut into (default 500)
 *   <li>{@code overlap-tokens} - trailing sentences carried into the next chunk when a section is
 *       split (default 50)
 *   <li>{@code tokenizer-model} - model whose subword encoding counts tokens (default gpt-4)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "lorekeeper.chunking")
public class ChunkingProperties {

  private int minTokens = 300;
  private int maxTokens = 800;
  private int targetTokens = 500;
  private int overlapTokens = 50;
  private String tokenizerModel = "gpt-4";

  /** Validates configuration at startup. Throws if the bounds are inconsistent. */
  @PostConstruct
  void validate() {
    if (minTokens < 1 || minTokens > targetTokens || targetTokens > maxTokens) {
      throw new IllegalStateException(
          "lorekeeper.chunking requires 1 <= min-tokens <= target-tokens <= max-tokens, got: "
              + minTokens
              + "/"
              + targetTokens
              + "/"
              + maxTokens);
    }
    if (overlapTokens < 0 || overlapTokens >= maxTokens) {
      throw new IllegalStateException(
          "lorekeeper.chunking.overlap-tokens must be in [0, max-tokens), got: " + overlapTokens);
    }
  }

  public int getMinTokens() {
    return minTokens;
  }

  public void setMinTokens(int minTokens) {
    this.minTokens = minTokens;
  }

  public int getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(int maxTokens) {
    this.maxTokens = maxTokens;
  }

  public int getTargetTokens() {
    return targetTokens;
  }

  public void setTargetTokens(int targetTokens) {
    this.targetTokens = targetTokens;
  }

  public int getOverlapTokens() {
    return overlapTokens;
  }

  public void setOverlapTokens(int overlapTokens) {
    this.overlapTokens = overlapTokens;
  }

  public String getTokenizerModel() {
    return tokenizerModel;
  }

  public void setTokenizerModel(String tokenizerModel) {
    this.tokenizerModel = tokenizerModel;
  }
}
