package dev.lorekeeper.ingestion;

/**
 * Totals of one backfill pass.
 *
 * @param dryRun whether the pass only estimated
 * @param resourcesProcessed resources embedded (or estimated) without error
 * @param chunksProcessed chunks embedded, or pending chunks counted in a dry run
 * @param estimatedTokens approximate tokens, 4 characters per token
 * @param estimatedCostUsd dollar cost derived from {@code estimatedTokens}
 * @param errors resources that failed and were skipped
 */
public record BackfillReport(
    boolean dryRun,
    int resourcesProcessed,
    int chunksProcessed,
    long estimatedTokens,
    double estimatedCostUsd,
    int errors) {}
