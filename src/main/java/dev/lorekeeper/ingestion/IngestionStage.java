package dev.lorekeeper.ingestion;

/** Pipeline stages, in execution order. Recorded with every failure. */
public enum IngestionStage {
  EXTRACTION,
  CHUNKING,
  CHUNK_INSERT,
  EMBEDDING
}
