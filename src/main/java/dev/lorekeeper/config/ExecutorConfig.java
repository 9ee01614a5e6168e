package dev.lorekeeper.config;

import dev.lorekeeper.ingestion.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for background work.
 *
 * <ul>
 *   <li>{@code ingestionExecutor} - fixed-size worker pool, one ingestion job per thread, with a
 *       bounded queue; submissions beyond it are rejected
 *   <li>{@code searchExecutor} - runs the vector and keyword halves of a hybrid search
 *   <li>{@code answerStreamExecutor} - retrieval and completion for streamed answers
 *   <li>{@code streamRelayExecutor} - forwards streamed answer events to connected clients. Relays
 *       block while waiting for events and must not share threads with the producers
 * </ul>
 *
 * <p>Both streaming pools hold one thread per open stream for its whole life. They hand tasks
 * straight to a thread instead of queueing them, so every accepted stream starts at once and a
 * stream beyond {@link #MAX_OPEN_STREAMS} is rejected rather than left waiting behind others.
 */
@Configuration
public class ExecutorConfig {

  private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

  static final int MAX_OPEN_STREAMS = 64;

  @Bean(name = "ingestionExecutor")
  public ThreadPoolTaskExecutor ingestionExecutor(IngestionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getWorkerThreads());
    executor.setMaxPoolSize(properties.getWorkerThreads());
    executor.setQueueCapacity(properties.getQueueCapacity());
    executor.setThreadNamePrefix("ingest-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    log.info(
        "Initialized ingestion executor: workers={}, queue={}",
        properties.getWorkerThreads(),
        properties.getQueueCapacity());
    return executor;
  }

  @Bean(name = "searchExecutor")
  public ThreadPoolTaskExecutor searchExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("search-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "answerStreamExecutor")
  public ThreadPoolTaskExecutor answerStreamExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(MAX_OPEN_STREAMS);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("answer-stream-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "streamRelayExecutor")
  public ThreadPoolTaskExecutor streamRelayExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(MAX_OPEN_STREAMS);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("sse-relay-");
    executor.initialize();
    return executor;
  }
}
