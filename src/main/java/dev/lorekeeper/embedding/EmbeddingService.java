package dev.lorekeeper.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.lorekeeper.document.ChunkEmbeddingStore;
import dev.lorekeeper.document.ChunkVector;
import dev.lorekeeper.document.PendingChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Turns texts into vectors through the {@link EmbeddingProvider} and persists chunk vectors.
 *
 * <p>Inputs are sent in batches of {@code batchSize}, one batch at a time. A rate-limited call is
 * retried with exponential backoff (1s, 2s, 4s, 8s, 16s by default); once {@code maxRetries}
 * retries are used up the call fails with {@link EmbeddingProviderExhaustedException}. Any other
 * provider error fails immediately.
 *
 * <p>{@link #embedChunks} writes each batch in its own transaction. A failing batch aborts the
 * remaining ones while earlier batches stay committed; re-running only targets chunks whose
 * embedding is still null.
 */
@Service
public class EmbeddingService {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

  private static final int CHARS_PER_TOKEN_ESTIMATE = 4;

  private final EmbeddingProvider provider;
  private final ChunkEmbeddingStore store;
  private final EmbeddingProperties properties;
  private final RetryTemplate retryTemplate;

  @Autowired
  public EmbeddingService(
      EmbeddingProvider provider, ChunkEmbeddingStore store, EmbeddingProperties properties) {
    this(provider, store, properties, new ThreadWaitSleeper());
  }

  EmbeddingService(
      EmbeddingProvider provider,
      ChunkEmbeddingStore store,
      EmbeddingProperties properties,
      Sleeper sleeper) {
    this.provider = provider;
    this.store = store;
    this.properties = properties;
    this.retryTemplate = rateLimitRetryTemplate(properties.retry(), sleeper);
  }

  /**
   * Embeds texts, preserving input order regardless of the order the provider answers in.
   *
   * @param texts the inputs; an empty list returns an empty list without calling the provider
   * @return one vector per input, in input order
   * @throws EmbeddingProviderExhaustedException if a batch stays rate limited after every retry
   * @throws EmbeddingProviderException for any other provider failure
   */
  public List<Embedding> embedTexts(List<String> texts) {
    List<Embedding> result = new ArrayList<>(texts.size());
    for (int from = 0; from < texts.size(); from += properties.batchSize()) {
      List<String> batch =
          texts.subList(from, Math.min(from + properties.batchSize(), texts.size()));
      result.addAll(callProvider(batch).vectors());
    }
    return result;
  }

  /** Embeds a single text, typically a search query. */
  public Embedding embedQuery(String text) {
    return callProvider(List.of(text)).vectors().get(0);
  }

  /**
   * Embeds chunks and writes each vector against its chunk, one transaction per batch.
   *
   * @param resourceId the owning resource, for logging
   * @param chunks chunks to embed, in the order they should be sent
   * @return usage accumulated over the committed batches
   * @throws EmbeddingProviderException if any batch fails; earlier batches remain committed
   */
  public EmbeddingUsage embedChunks(UUID resourceId, List<PendingChunk> chunks) {
    if (chunks.isEmpty()) {
      return EmbeddingUsage.NONE;
    }
    int written = 0;
    long estimatedTokens = 0;
    long providerTokens = 0;
    int batchCount = (chunks.size() + properties.batchSize() - 1) / properties.batchSize();

    for (int from = 0, batchNumber = 1;
        from < chunks.size();
        from += properties.batchSize(), batchNumber++) {
      List<PendingChunk> batch =
          chunks.subList(from, Math.min(from + properties.batchSize(), chunks.size()));
      OrderedVectors vectors = callProvider(batch.stream().map(PendingChunk::text).toList());

      List<ChunkVector> updates = new ArrayList<>(batch.size());
      for (int i = 0; i < batch.size(); i++) {
        updates.add(new ChunkVector(batch.get(i).id(), vectors.vectors().get(i)));
      }
      written += store.writeBatch(updates);
      estimatedTokens += batch.stream().mapToLong(c -> estimateTokens(c.text())).sum();
      providerTokens += vectors.totalTokens();
      log.debug(
          "Resource {}: embedded batch {}/{} ({} chunks)",
          resourceId,
          batchNumber,
          batchCount,
          batch.size());
    }

    EmbeddingUsage usage =
        new EmbeddingUsage(written, estimatedTokens, providerTokens, estimateCost(estimatedTokens));
    log.info(
        "Resource {}: embedded {} chunks, ~{} tokens (provider reported {}), est. ${}",
        resourceId,
        usage.chunksEmbedded(),
        usage.estimatedTokens(),
        usage.providerReportedTokens(),
        String.format("%.6f", usage.estimatedCostUsd()));
    return usage;
  }

  /** Approximate token count used for cost estimates: one token per four characters, rounded up. */
  public static long estimateTokens(String text) {
    return (text.length() + CHARS_PER_TOKEN_ESTIMATE - 1) / CHARS_PER_TOKEN_ESTIMATE;
  }

  /** Dollar cost for the given number of tokens at the configured per-million rate. */
  public double estimateCost(long tokens) {
    return tokens / 1_000_000.0 * properties.costPerMillionTokens();
  }

  public String modelName() {
    return provider.modelName();
  }

  private OrderedVectors callProvider(List<String> batch) {
    EmbeddingBatch response;
    try {
      response = retryTemplate.execute(context -> provider.embed(batch));
    } catch (ProviderRateLimitedException e) {
      throw new EmbeddingProviderExhaustedException(properties.retry().maxRetries() + 1, e);
    }
    return order(response, batch.size());
  }

  private static OrderedVectors order(EmbeddingBatch response, int expected) {
    List<IndexedEmbedding> sorted =
        response.embeddings().stream()
            .sorted(Comparator.comparingInt(IndexedEmbedding::index))
            .toList();
    if (sorted.size() != expected) {
      throw new EmbeddingProviderException(
          "Provider returned " + sorted.size() + " embeddings for " + expected + " inputs");
    }
    List<Embedding> vectors = new ArrayList<>(expected);
    for (int i = 0; i < expected; i++) {
      if (sorted.get(i).index() != i) {
        throw new EmbeddingProviderException("Provider response is missing input index " + i);
      }
      vectors.add(sorted.get(i).embedding());
    }
    return new OrderedVectors(vectors, response.totalTokens());
  }

  private static RetryTemplate rateLimitRetryTemplate(
      EmbeddingProperties.Retry retry, Sleeper sleeper) {
    ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
    backOff.setInitialInterval(retry.initialBackoffMs());
    backOff.setMultiplier(retry.multiplier());
    backOff.setMaxInterval(retry.maxBackoffMs());
    backOff.setSleeper(sleeper);

    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(
        new SimpleRetryPolicy(
            retry.maxRetries() + 1, Map.of(ProviderRateLimitedException.class, true)));
    template.setBackOffPolicy(backOff);
    template.registerListener(
        new RetryListener() {
          @Override
          public <T, E extends Throwable> void onError(
              RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            if (throwable instanceof ProviderRateLimitedException) {
              log.warn(
                  "Embedding provider rate limited (attempt {}/{})",
                  context.getRetryCount(),
                  retry.maxRetries() + 1);
            }
          }
        });
    return template;
  }

  private record OrderedVectors(List<Embedding> vectors, int totalTokens) {}
}
