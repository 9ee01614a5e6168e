package dev.lorekeeper.ingestion;

import dev.lorekeeper.document.ChunkEmbeddingStore;
import dev.lorekeeper.document.PendingChunk;
import dev.lorekeeper.embedding.EmbeddingService;
import dev.lorekeeper.embedding.EmbeddingUsage;
import dev.lorekeeper.resource.Resource;
import dev.lorekeeper.resource.ResourceRepository;
import dev.lorekeeper.resource.ResourceStatus;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Completes missing chunk embeddings out of band.
 *
 * <p>Finds finished resources that still have chunks with a null embedding and embeds only those
 * chunks. Vector writes never overwrite an existing embedding, so the pass can be re-run any
 * number of times; a chunk is embedded at most once. A failing resource is counted and skipped.
 */
@Service
public class EmbeddingBackfillService {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingBackfillService.class);

  private final ChunkEmbeddingStore chunkStore;
  private final EmbeddingService embeddingService;
  private final ResourceRepository resourceRepository;
  private final Clock clock;

  public EmbeddingBackfillService(
      ChunkEmbeddingStore chunkStore,
      EmbeddingService embeddingService,
      ResourceRepository resourceRepository,
      Clock clock) {
    this.chunkStore = chunkStore;
    this.embeddingService = embeddingService;
    this.resourceRepository = resourceRepository;
    this.clock = clock;
  }

  /**
   * Runs one backfill pass.
   *
   * @param resourceId restrict to this resource, or {@code null}
   * @param collectionId restrict to this collection, or {@code null}
   * @param dryRun estimate tokens and cost without calling the provider or writing anything
   * @return totals for the pass
   */
  public BackfillReport backfill(
      @Nullable UUID resourceId, @Nullable UUID collectionId, boolean dryRun) {
    List<UUID> resources = chunkStore.findResourcesWithPendingChunks(resourceId, collectionId);
    if (resources.isEmpty()) {
      log.info("No resources need embedding backfill");
      return new BackfillReport(dryRun, 0, 0, 0, 0.0, 0);
    }
    log.info("Backfilling embeddings for {} resources (dryRun={})", resources.size(), dryRun);

    int processed = 0;
    int chunks = 0;
    long tokens = 0;
    double cost = 0.0;
    int errors = 0;

    for (UUID id : resources) {
      try {
        List<PendingChunk> pending = chunkStore.findPendingChunks(id);
        if (pending.isEmpty()) {
          log.debug("Resource {}: no chunks need embeddings", id);
          continue;
        }
        if (dryRun) {
          long estimate =
              pending.stream().mapToLong(c -> EmbeddingService.estimateTokens(c.text())).sum();
          log.info("Resource {}: would embed {} chunks, ~{} tokens", id, pending.size(), estimate);
          chunks += pending.size();
          tokens += estimate;
          cost += embeddingService.estimateCost(estimate);
        } else {
          EmbeddingUsage usage = embeddingService.embedChunks(id, pending);
          recordBackfill(id, usage);
          chunks += usage.chunksEmbedded();
          tokens += usage.estimatedTokens();
          cost += usage.estimatedCostUsd();
        }
        processed++;
      } catch (RuntimeException e) {
        errors++;
        log.error("Resource {}: embedding backfill failed: {}", id, e.getMessage());
      }
    }

    BackfillReport report = new BackfillReport(dryRun, processed, chunks, tokens, cost, errors);
    log.info(
        "Backfill finished: {} resources, {} chunks, ~{} tokens, est. ${}, {} errors",
        report.resourcesProcessed(),
        report.chunksProcessed(),
        report.estimatedTokens(),
        String.format("%.6f", report.estimatedCostUsd()),
        report.errors());
    return report;
  }

  private void recordBackfill(UUID resourceId, EmbeddingUsage usage) {
    Resource resource =
        resourceRepository
            .findById(resourceId)
            .orElseThrow(() -> new IllegalStateException("Resource vanished: " + resourceId));
    resource.removeMetadata("embeddingError", "embeddingErrorAt", "failedStage");
    resource.putMetadata(
        Map.of(
            "embeddingBackfillTokens", usage.estimatedTokens(),
            "embeddingBackfillCost", usage.estimatedCostUsd(),
            "embeddingsGenerated", true,
            "embeddingBackfilledAt", clock.instant().toString()));
    if (resource.getStatus() == ResourceStatus.COMPLETED_NO_EMBEDDINGS) {
      resource.setStatus(ResourceStatus.COMPLETED);
      resource.setIngestionError(null);
    }
    resourceRepository.save(resource);
  }
}
