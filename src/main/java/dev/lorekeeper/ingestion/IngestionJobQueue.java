package dev.lorekeeper.ingestion;

/** Accepts ingestion jobs for asynchronous processing by the worker pool. */
public interface IngestionJobQueue {

  /**
   * Submits a job. A job for a resource that is already queued or running is not run twice at the
   * same time.
   *
   * @param job the job to run
   * @return {@code true} if the job was accepted, {@code false} if the resource is in flight
   * @throws org.springframework.core.task.TaskRejectedException if the queue is full
   */
  boolean submit(ResourceIngestionJob job);
}
