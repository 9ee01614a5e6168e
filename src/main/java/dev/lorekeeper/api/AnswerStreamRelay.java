package dev.lorekeeper.api;

import dev.lorekeeper.answer.AnswerStream;
import dev.lorekeeper.answer.StreamEvent;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Forwards the events of an {@link AnswerStream} to an {@link SseEmitter}. When the client
 * disconnects or the emitter times out the stream is detached, which stops forwarding while the
 * answer is still finalised server-side.
 */
@Component
public class AnswerStreamRelay {

  private static final Logger log = LoggerFactory.getLogger(AnswerStreamRelay.class);

  static final Duration POLL_INTERVAL = Duration.ofMillis(250);

  private final Executor executor;

  public AnswerStreamRelay(@Qualifier("streamRelayExecutor") Executor executor) {
    this.executor = executor;
  }

  /**
   * Starts forwarding on the relay pool and returns immediately.
   *
   * @throws TaskRejectedException if no relay thread is free; the stream is detached first
   */
  public void relay(AnswerStream stream, SseEmitter emitter) {
    emitter.onTimeout(stream::detach);
    emitter.onError(error -> stream.detach());
    emitter.onCompletion(stream::detach);
    try {
      executor.execute(() -> forward(stream, emitter));
    } catch (TaskRejectedException e) {
      stream.detach();
      throw e;
    }
  }

  void forward(AnswerStream stream, SseEmitter emitter) {
    try {
      while (!stream.isDetached()) {
        StreamEvent event = stream.poll(POLL_INTERVAL);
        if (event == null) {
          continue;
        }
        emitter.send(
            SseEmitter.event().name(event.type()).data(event, MediaType.APPLICATION_JSON));
        if (event.isTerminal()) {
          emitter.complete();
          return;
        }
      }
    } catch (IOException | IllegalStateException e) {
      log.debug("Client left the answer stream: {}", e.getMessage());
      stream.detach();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      stream.detach();
      emitter.complete();
    }
  }
}
