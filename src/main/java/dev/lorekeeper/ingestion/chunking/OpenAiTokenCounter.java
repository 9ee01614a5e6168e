package dev.lorekeeper.ingestion.chunking;

import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import org.springframework.stereotype.Component;

/** {@link TokenCounter} backed by the OpenAI BPE encoding for the configured model. */
@Component
public class OpenAiTokenCounter implements TokenCounter {

  private final OpenAiTokenCountEstimator estimator;

  public OpenAiTokenCounter(ChunkingProperties properties) {
    this.estimator = new OpenAiTokenCountEstimator(properties.getTokenizerModel());
  }

  @Override
  public int count(String text) {
    if (text.isEmpty()) {
      return 0;
    }
    return estimator.estimateTokenCountInText(text);
  }
}
