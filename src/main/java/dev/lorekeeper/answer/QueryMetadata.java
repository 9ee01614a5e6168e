package dev.lorekeeper.answer;

import java.util.UUID;

/**
 * Usage and timing reported with every answer.
 *
 * @param model completion model, or {@code "none"} when no completion was requested
 * @param promptTokens provider-reported prompt tokens
 * @param completionTokens provider-reported completion tokens
 * @param latencyMs end-to-end latency
 * @param searchLatencyMs time spent retrieving excerpts
 * @param llmLatencyMs time spent waiting for the completion provider
 * @param chunksRetrieved number of excerpts used
 * @param conversationId conversation the query belongs to
 */
public record QueryMetadata(
    String model,
    int promptTokens,
    int completionTokens,
    long latencyMs,
    long searchLatencyMs,
    long llmLatencyMs,
    int chunksRetrieved,
    UUID conversationId) {}
