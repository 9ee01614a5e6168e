package dev.lorekeeper.embedding;

/**
 * Usage accumulated by {@link EmbeddingService#embedChunks}.
 *
 * <p>Two token figures are kept apart. {@code estimatedTokens} is the 4-characters-per-token
 * approximation the cost estimate is computed from. {@code providerReportedTokens} is what the
 * provider billed. Neither is the subword count used to size chunks.
 *
 * @param chunksEmbedded number of chunk vectors actually written
 * @param estimatedTokens approximate tokens, {@code ceil(length / 4)} per text
 * @param providerReportedTokens tokens reported by the provider
 * @param estimatedCostUsd dollar cost derived from {@code estimatedTokens}
 */
public record EmbeddingUsage(
    int chunksEmbedded,
    long estimatedTokens,
    long providerReportedTokens,
    double estimatedCostUsd) {

  public static final EmbeddingUsage NONE = new EmbeddingUsage(0, 0, 0, 0.0);
}
