package dev.lorekeeper.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.embedding.Embedding;
import dev.lorekeeper.document.ChunkEmbeddingStore;
import dev.lorekeeper.document.ChunkVector;
import dev.lorekeeper.document.PendingChunk;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.jspecify.annotations.Nullable;

/**
 * Whatever order the provider answers in and however inputs are batched, every vector lands on
 * the input it was computed for.
 */
class EmbeddingOrderPropertyTest {

  @Property
  void vectorsFollowInputOrder(
      @ForAll @IntRange(min = 0, max = 40) int inputCount,
      @ForAll @IntRange(min = 1, max = 7) int batchSize,
      @ForAll long seed) {
    List<String> inputs = new ArrayList<>();
    for (int i = 0; i < inputCount; i++) {
      inputs.add(String.valueOf(i));
    }
    EmbeddingService service =
        new EmbeddingService(
            new ShufflingProvider(new Random(seed)),
            new UnusedStore(),
            EmbeddingServiceTest.properties(batchSize),
            backOff -> {});

    List<Embedding> vectors = service.embedTexts(inputs);

    assertThat(vectors).hasSize(inputCount);
    for (int i = 0; i < inputCount; i++) {
      assertThat(vectors.get(i).vector()[0]).isEqualTo((float) i);
    }
  }

  /** Encodes each input's numeric value in its vector and answers in a random order. */
  private static final class ShufflingProvider implements EmbeddingProvider {

    private final Random random;

    ShufflingProvider(Random random) {
      this.random = random;
    }

    @Override
    public EmbeddingBatch embed(List<String> inputs) {
      List<IndexedEmbedding> embeddings = new ArrayList<>();
      for (int i = 0; i < inputs.size(); i++) {
        float value = Float.parseFloat(inputs.get(i));
        embeddings.add(new IndexedEmbedding(i, Embedding.from(new float[] {value})));
      }
      Collections.shuffle(embeddings, random);
      return new EmbeddingBatch(embeddings, inputs.size());
    }

    @Override
    public String modelName() {
      return "shuffling";
    }
  }

  private static final class UnusedStore implements ChunkEmbeddingStore {

    @Override
    public List<PendingChunk> findPendingChunks(UUID resourceId) {
      throw new UnsupportedOperationException();
    }

    @Override
    public List<UUID> findResourcesWithPendingChunks(
        @Nullable UUID resourceId, @Nullable UUID collectionId) {
      throw new UnsupportedOperationException();
    }

    @Override
    public int writeBatch(List<ChunkVector> vectors) {
      throw new UnsupportedOperationException();
    }
  }
}
