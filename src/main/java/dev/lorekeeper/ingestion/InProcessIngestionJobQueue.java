package dev.lorekeeper.ingestion;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * {@link IngestionJobQueue} backed by the bounded {@code ingestionExecutor} pool. Each worker
 * thread runs one job at a time; a resource is tracked as in flight from submission until its job
 * finishes.
 */
@Component
public class InProcessIngestionJobQueue implements IngestionJobQueue {

  private static final Logger log = LoggerFactory.getLogger(InProcessIngestionJobQueue.class);

  private final Executor executor;
  private final IngestionService ingestionService;
  private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

  public InProcessIngestionJobQueue(
      @Qualifier("ingestionExecutor") Executor executor, IngestionService ingestionService) {
    this.executor = executor;
    this.ingestionService = ingestionService;
  }

  @Override
  public boolean submit(ResourceIngestionJob job) {
    if (!inFlight.add(job.resourceId())) {
      log.info("Resource {} is already queued or processing, skipping", job.resourceId());
      return false;
    }
    try {
      executor.execute(() -> run(job));
    } catch (TaskRejectedException e) {
      inFlight.remove(job.resourceId());
      throw e;
    }
    log.debug("Queued ingestion of resource {}", job.resourceId());
    return true;
  }

  /** Whether a job for the resource is queued or running. */
  public boolean isInFlight(UUID resourceId) {
    return inFlight.contains(resourceId);
  }

  private void run(ResourceIngestionJob job) {
    try {
      IngestionService.IngestResult result = ingestionService.process(job);
      log.info(
          "Ingestion job for resource {} finished: {} ({} chunks)",
          job.resourceId(),
          result.status(),
          result.chunkCount());
    } catch (IngestionFailedException e) {
      log.error(
          "Ingestion job for resource {} failed at {}: {}",
          job.resourceId(),
          e.getStage(),
          e.getCause().getMessage());
    } catch (RuntimeException e) {
      log.error("Ingestion job for resource {} failed", job.resourceId(), e);
    } finally {
      inFlight.remove(job.resourceId());
    }
  }
}
