package dev.lorekeeper.answer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;

/**
 * One event of a streamed answer: any number of {@link Chunk}s followed by exactly one {@link Done}
 * or {@link Failed}.
 */
public sealed interface StreamEvent {

  /** Event name, also used as the SSE event name. */
  @JsonProperty("type")
  String type();

  /** Whether the stream ends with this event. */
  @JsonIgnore
  default boolean isTerminal() {
    return !(this instanceof Chunk);
  }

  /** An incremental fragment of answer text. */
  record Chunk(String content) implements StreamEvent {
    @Override
    public String type() {
      return "chunk";
    }
  }

  /** The answer is complete and logged. */
  record Done(UUID queryId, List<SourceReference> sources, QueryMetadata metadata)
      implements StreamEvent {
    @Override
    public String type() {
      return "done";
    }
  }

  /** The query failed; no further events follow. */
  record Failed(String error) implements StreamEvent {
    @Override
    public String type() {
      return "error";
    }
  }
}
