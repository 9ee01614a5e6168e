package dev.lorekeeper.answer;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * One earlier turn of a conversation, replayed to the completion provider.
 *
 * @param role who said it
 * @param content what was said
 */
public record ConversationMessage(Role role, String content) {

  public ConversationMessage {
    if (role == null) {
      throw new IllegalArgumentException("role must not be null");
    }
    if (content == null) {
      throw new IllegalArgumentException("content must not be null");
    }
  }

  /** Speaker of a conversation message. */
  public enum Role {
    USER,
    ASSISTANT;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
