package dev.lorekeeper.ingestion;

import dev.lorekeeper.document.PendingChunk;
import dev.lorekeeper.embedding.EmbeddingService;
import dev.lorekeeper.embedding.EmbeddingUsage;
import dev.lorekeeper.ingestion.chunking.ChunkData;
import dev.lorekeeper.ingestion.chunking.DocumentChunker;
import dev.lorekeeper.ingestion.extraction.DocumentExtractor;
import dev.lorekeeper.ingestion.extraction.ExtractedPage;
import dev.lorekeeper.ingestion.extraction.ExtractionResult;
import dev.lorekeeper.ingestion.extraction.FormatUnsupportedException;
import dev.lorekeeper.resource.Resource;
import dev.lorekeeper.resource.ResourceFileStore;
import dev.lorekeeper.resource.ResourceNotFoundException;
import dev.lorekeeper.resource.ResourceRepository;
import dev.lorekeeper.resource.ResourceStatus;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the ingestion pipeline for one resource: extract -> chunk -> store chunks -> embed.
 *
 * <p>Stages run sequentially on the calling worker thread. Status transitions:
 *
 * <ul>
 *   <li>a failure while resolving, extracting, chunking or storing marks the resource {@code
 *       FAILED} with a {@code [STAGE] message} error and rethrows as {@link
 *       IngestionFailedException}
 *   <li>an embedding failure keeps the stored chunks and ends in {@code COMPLETED_NO_EMBEDDINGS};
 *       the backfill pass completes the vectors later
 *   <li>otherwise the resource ends {@code COMPLETED}
 * </ul>
 *
 * <p><strong>Redelivery:</strong> a job may be delivered more than once. A resource that already
 * reached a completed state is left alone. Any other state re-runs from the top; chunks are
 * replaced rather than appended and usage metadata keys are overwritten, so nothing is
 * double-counted.
 */
@Service
public class IngestionService {

  private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

  private final ResourceRepository resourceRepository;
  private final ResourceFileStore fileStore;
  private final DocumentExtractor extractor;
  private final DocumentChunker chunker;
  private final ResourceChunkWriter chunkWriter;
  private final EmbeddingService embeddingService;
  private final IngestionProperties properties;
  private final Clock clock;

  public IngestionService(
      ResourceRepository resourceRepository,
      ResourceFileStore fileStore,
      DocumentExtractor extractor,
      DocumentChunker chunker,
      ResourceChunkWriter chunkWriter,
      EmbeddingService embeddingService,
      IngestionProperties properties,
      Clock clock) {
    this.resourceRepository = resourceRepository;
    this.fileStore = fileStore;
    this.extractor = extractor;
    this.chunker = chunker;
    this.chunkWriter = chunkWriter;
    this.embeddingService = embeddingService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Processes a single job.
   *
   * @param job the resource to ingest
   * @return the terminal status, chunk count and embedding usage
   * @throws ResourceNotFoundException if the resource does not exist
   * @throws IngestionFailedException if extraction, chunking or chunk storage failed
   */
  public IngestResult process(ResourceIngestionJob job) {
    Resource resource =
        resourceRepository
            .findById(job.resourceId())
            .orElseThrow(() -> new ResourceNotFoundException(job.resourceId()));

    if (resource.getStatus().isSearchable()) {
      log.info(
          "Resource {} already {}, ignoring redelivered job",
          resource.getId(),
          resource.getStatus());
      int chunks = resource.getTotalChunks() != null ? resource.getTotalChunks() : 0;
      return new IngestResult(resource.getStatus(), chunks, EmbeddingUsage.NONE);
    }

    resource.startProcessing(clock.instant());
    resource = resourceRepository.save(resource);
    log.info(
        "Resource {}: processing {} (attempt {})",
        resource.getId(),
        resource.getOriginalFilename(),
        resource.getProcessingAttempts());

    List<PendingChunk> stored = extractAndStore(resource, job);
    return embed(resource, stored);
  }

  private List<PendingChunk> extractAndStore(Resource resource, ResourceIngestionJob job) {
    IngestionStage stage = IngestionStage.EXTRACTION;
    try {
      Path file = fileStore.resolve(job.filePath());
      checkExtension(file);
      ExtractionResult extracted = extractor.extract(file);
      recordExtraction(resource, extracted);
      resourceRepository.save(resource);

      stage = IngestionStage.CHUNKING;
      List<ChunkData> chunks = chunker.chunk(extracted.pages());
      log.info(
          "Resource {}: {} pages -> {} chunks",
          resource.getId(),
          extracted.totalPages(),
          chunks.size());

      stage = IngestionStage.CHUNK_INSERT;
      return chunkWriter.replaceChunks(resource.getId(), chunks);
    } catch (RuntimeException e) {
      throw fail(resource, stage, e);
    }
  }

  private IngestResult embed(Resource resource, List<PendingChunk> stored) {
    Instant now;
    ResourceStatus terminal;
    EmbeddingUsage usage = EmbeddingUsage.NONE;
    try {
      usage = embeddingService.embedChunks(resource.getId(), stored);
      now = clock.instant();
      resource.removeMetadata("embeddingError", "embeddingErrorAt", "failedStage");
      resource.putMetadata(
          Map.of(
              "embeddingTokens", usage.estimatedTokens(),
              "embeddingProviderTokens", usage.providerReportedTokens(),
              "embeddingCost", usage.estimatedCostUsd(),
              "embeddingModel", embeddingService.modelName(),
              "embeddingsGenerated", true,
              "embeddingGeneratedAt", now.toString()));
      terminal = ResourceStatus.COMPLETED;
    } catch (RuntimeException e) {
      now = clock.instant();
      String error = IngestionFailedException.describe(IngestionStage.EMBEDDING, e);
      log.error(
          "Resource {}: stage {} failed, keeping {} chunks without embeddings: {}",
          resource.getId(),
          IngestionStage.EMBEDDING,
          stored.size(),
          e.getMessage());
      resource.setIngestionError(error);
      resource.putMetadata(
          Map.of(
              "embeddingsGenerated", false,
              "embeddingError", String.valueOf(e.getMessage()),
              "embeddingErrorAt", now.toString(),
              "failedStage", IngestionStage.EMBEDDING.name()));
      terminal = ResourceStatus.COMPLETED_NO_EMBEDDINGS;
    }

    resource.setTotalChunks(stored.size());
    resource.finishProcessing(terminal, now);
    resourceRepository.save(resource);
    log.info(
        "Resource {}: {} with {} chunks in {} ms",
        resource.getId(),
        terminal,
        stored.size(),
        resource.getProcessingDurationMs());
    return new IngestResult(terminal, stored.size(), usage);
  }

  private void checkExtension(Path file) {
    String extension = DocumentExtractor.extensionOf(file.getFileName().toString());
    if (!properties.getSupportedExtensions().contains(extension)) {
      throw new FormatUnsupportedException(
          extension,
          "Unsupported file type: ."
              + extension
              + ". Allowed: "
              + String.join(", ", properties.getSupportedExtensions()));
    }
  }

  private static void recordExtraction(Resource resource, ExtractionResult extracted) {
    resource.setTotalPages(extracted.totalPages());
    if (resource.getTitle() == null) {
      resource.setTitle(extracted.metadata().title());
    }
    if (resource.getAuthor() == null) {
      resource.setAuthor(extracted.metadata().author());
    }
    Map<String, Object> details = new HashMap<>(extracted.metadata().extraProperties());
    details.put("hasImages", extracted.pages().stream().anyMatch(ExtractedPage::hasImages));
    details.put("hasTables", extracted.pages().stream().anyMatch(ExtractedPage::hasTables));
    resource.putMetadata(details);
  }

  private IngestionFailedException fail(
      Resource resource, IngestionStage stage, RuntimeException e) {
    IngestionFailedException failure = new IngestionFailedException(resource.getId(), stage, e);
    log.error("Resource {}: stage {} failed: {}", resource.getId(), stage, e.getMessage());
    resource.setIngestionError(failure.getMessage());
    resource.putMetadata(Map.of("failedStage", stage.name()));
    resource.finishProcessing(ResourceStatus.FAILED, clock.instant());
    resourceRepository.save(resource);
    return failure;
  }

  /**
   * Outcome of processing one job.
   *
   * @param status terminal status of the resource
   * @param chunkCount number of chunks stored
   * @param usage embedding usage, {@link EmbeddingUsage#NONE} when embedding did not run
   */
  public record IngestResult(ResourceStatus status, int chunkCount, EmbeddingUsage usage) {}
}
