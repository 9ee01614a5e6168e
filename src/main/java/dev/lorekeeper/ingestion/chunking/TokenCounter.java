package dev.lorekeeper.ingestion.chunking;

/** Counts subword tokens. The same encoding must be used everywhere chunk sizes are compared. */
@FunctionalInterface
public interface TokenCounter {

  int count(String text);
}
