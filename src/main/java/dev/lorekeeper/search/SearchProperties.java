package dev.lorekeeper.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code lorekeeper.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code rrf-k} - reciprocal-rank fusion constant added to every rank (default 60)
 *   <li>{@code candidate-multiplier} - each list fetches {@code topK * multiplier} candidates
 *       before fusion (default 2)
 *   <li>{@code default-top-k} - results returned when the caller does not say (default 10)
 *   <li>{@code max-top-k} - largest accepted {@code topK} (default 20)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "lorekeeper.search")
public class SearchProperties {

  private int rrfK = 60;
  private int candidateMultiplier = 2;
  private int defaultTopK = 10;
  private int maxTopK = 20;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (rrfK < 1) {
      throw new IllegalStateException("lorekeeper.search.rrf-k must be positive, got: " + rrfK);
    }
    if (candidateMultiplier < 1 || candidateMultiplier > 10) {
      throw new IllegalStateException(
          "lorekeeper.search.candidate-multiplier must be in [1, 10], got: " + candidateMultiplier);
    }
    if (defaultTopK < 1 || defaultTopK > maxTopK) {
      throw new IllegalStateException(
          "lorekeeper.search.default-top-k must be in [1, max-top-k], got: " + defaultTopK);
    }
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public int getCandidateMultiplier() {
    return candidateMultiplier;
  }

  public void setCandidateMultiplier(int candidateMultiplier) {
    this.candidateMultiplier = candidateMultiplier;
  }

  public int getDefaultTopK() {
    return defaultTopK;
  }

  public void setDefaultTopK(int defaultTopK) {
    this.defaultTopK = defaultTopK;
  }

  public int getMaxTopK() {
    return maxTopK;
  }

  public void setMaxTopK(int maxTopK) {
    this.maxTopK = maxTopK;
  }
}
