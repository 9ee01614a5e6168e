package dev.lorekeeper.answer;

import java.util.List;
import java.util.UUID;

/**
 * A grounded answer with its cited sources.
 *
 * @param queryId handle for feedback; the id of the query log row when one was written
 * @param answer generated text
 * @param sources excerpts the answer was generated from, in rank order
 * @param metadata usage and timing
 */
public record AnswerResponse(
    UUID queryId, String answer, List<SourceReference> sources, QueryMetadata metadata) {}
