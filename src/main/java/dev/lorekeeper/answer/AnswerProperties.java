package dev.lorekeeper.answer;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for answer generation.
 *
 * <p>Properties are bound from {@code lorekeeper.answer.*} in application.yml.
 *
 * <ul>
 *   <li>{@code history-messages} - most recent conversation messages sent with a question
 *       (default 4, two exchanges)
 *   <li>{@code latency-target-ms} - end-to-end target; slower queries are logged at WARN (default
 *       2000)
 *   <li>{@code preview-length} - characters of chunk content included in each source (default 200)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "lorekeeper.answer")
public class AnswerProperties {

  private int historyMessages = 4;
  private long latencyTargetMs = 2000;
  private int previewLength = 200;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (historyMessages < 0) {
      throw new IllegalStateException(
          "lorekeeper.answer.history-messages must not be negative, got: " + historyMessages);
    }
    if (latencyTargetMs < 1) {
      throw new IllegalStateException(
          "lorekeeper.answer.latency-target-ms must be positive, got: " + latencyTargetMs);
    }
    if (previewLength < 1) {
      throw new IllegalStateException(
          "lorekeeper.answer.preview-length must be positive, got: " + previewLength);
    }
  }

  public int getHistoryMessages() {
    return historyMessages;
  }

  public void setHistoryMessages(int historyMessages) {
    this.historyMessages = historyMessages;
  }

  public long getLatencyTargetMs() {
    return latencyTargetMs;
  }

  public void setLatencyTargetMs(long latencyTargetMs) {
    this.latencyTargetMs = latencyTargetMs;
  }

  public int getPreviewLength() {
    return previewLength;
  }

  public void setPreviewLength(int previewLength) {
    this.previewLength = previewLength;
  }
}
