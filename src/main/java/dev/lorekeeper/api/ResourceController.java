package dev.lorekeeper.api;

import dev.lorekeeper.ingestion.BackfillReport;
import dev.lorekeeper.ingestion.EmbeddingBackfillService;
import dev.lorekeeper.ingestion.IngestionJobQueue;
import dev.lorekeeper.ingestion.ResourceIngestionJob;
import dev.lorekeeper.resource.Resource;
import dev.lorekeeper.resource.ResourceNotFoundException;
import dev.lorekeeper.resource.ResourceRepository;
import dev.lorekeeper.resource.ResourceStatus;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Ingestion triggers and status for uploaded resources, plus the embedding backfill. */
@RestController
@RequestMapping("/api")
public class ResourceController {

  private final ResourceRepository resourceRepository;
  private final IngestionJobQueue jobQueue;
  private final EmbeddingBackfillService backfillService;

  public ResourceController(
      ResourceRepository resourceRepository,
      IngestionJobQueue jobQueue,
      EmbeddingBackfillService backfillService) {
    this.resourceRepository = resourceRepository;
    this.jobQueue = jobQueue;
    this.backfillService = backfillService;
  }

  /** Queues the resource for ingestion. Answers 202; {@code queued} is false if in flight. */
  @PostMapping("/resources/{resourceId}/process")
  public ResponseEntity<ProcessResponse> process(@PathVariable UUID resourceId) {
    Resource resource =
        resourceRepository
            .findById(resourceId)
            .orElseThrow(() -> new ResourceNotFoundException(resourceId));
    boolean queued =
        jobQueue.submit(
            new ResourceIngestionJob(
                resource.getId(), resource.getCollectionId(), resource.getFileUrl()));
    return ResponseEntity.accepted().body(new ProcessResponse(resourceId, queued));
  }

  @GetMapping("/resources/{resourceId}")
  public ResourceView get(@PathVariable UUID resourceId) {
    return resourceRepository
        .findById(resourceId)
        .map(ResourceView::from)
        .orElseThrow(() -> new ResourceNotFoundException(resourceId));
  }

  @PostMapping("/admin/embeddings/backfill")
  public BackfillReport backfill(
      @RequestParam(required = false) @Nullable UUID resourceId,
      @RequestParam(required = false) @Nullable UUID collectionId,
      @RequestParam(defaultValue = "false") boolean dryRun) {
    return backfillService.backfill(resourceId, collectionId, dryRun);
  }

  /** Acknowledgement of a processing request. */
  public record ProcessResponse(UUID resourceId, boolean queued) {}

  /** Ingestion state of one resource. */
  public record ResourceView(
      UUID id,
      UUID collectionId,
      String originalFilename,
      ResourceStatus status,
      @Nullable String ingestionError,
      @Nullable Integer totalPages,
      @Nullable Integer totalChunks,
      Map<String, Object> metadata) {

    static ResourceView from(Resource resource) {
      return new ResourceView(
          resource.getId(),
          resource.getCollectionId(),
          resource.getOriginalFilename(),
          resource.getStatus(),
          resource.getIngestionError(),
          resource.getTotalPages(),
          resource.getTotalChunks(),
          resource.getMetadata());
    }
  }
}
