package dev.lorekeeper.answer;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;

/**
 * Producer/consumer channel for one streamed answer.
 *
 * <p>The producer {@linkplain #emit emits} text fragments and exactly one terminal event; the
 * consumer {@linkplain #poll polls} them in order. A consumer that goes away calls {@link #detach}:
 * later fragments are dropped while the producer keeps running, so the answer is still finalised
 * and logged. {@link #completion()} completes with the final response, or exceptionally with the
 * failure, whether or not anyone is still reading.
 */
public final class AnswerStream {

  private final BlockingQueue<StreamEvent> events = new LinkedBlockingQueue<>();
  private final CompletableFuture<AnswerResponse> completion = new CompletableFuture<>();
  private volatile boolean detached;

  void emit(StreamEvent event) {
    if (!detached) {
      events.add(event);
    }
  }

  void complete(AnswerResponse response) {
    emit(new StreamEvent.Done(response.queryId(), response.sources(), response.metadata()));
    completion.complete(response);
  }

  void fail(RuntimeException error) {
    String message = error.getMessage() == null ? error.toString() : error.getMessage();
    emit(new StreamEvent.Failed(message));
    completion.completeExceptionally(error);
  }

  /**
   * Waits up to {@code timeout} for the next event.
   *
   * @return the next event, or {@code null} if none arrived in time
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public @Nullable StreamEvent poll(Duration timeout) throws InterruptedException {
    return events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Stops buffering events for a consumer that has gone away. */
  public void detach() {
    detached = true;
    events.clear();
  }

  public boolean isDetached() {
    return detached;
  }

  /** Completes once the answer is generated and logged, or the query fails. */
  public CompletableFuture<AnswerResponse> completion() {
    return completion;
  }
}
