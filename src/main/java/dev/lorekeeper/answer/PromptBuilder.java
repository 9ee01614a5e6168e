package dev.lorekeeper.answer;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.lorekeeper.search.ScoredChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/**
 * Builds the grounded message list sent to the completion provider: the system prompt, the most
 * recent conversation history, then the question with every retrieved excerpt labelled by rank,
 * page and section.
 */
@Component
public class PromptBuilder {

  static final String SYSTEM_PROMPT =
      """
      You are a rules and lore assistant helping a Game Master run a tabletop roleplaying campaign.

      Answer using ONLY the excerpts supplied with the question. They come from the Game Master's
      own campaign materials.

      Grounding rules:
      1. Every claim must come from the excerpts. Do not use general knowledge of other games.
      2. Cite the page and section for every claim in the form [Page X, Section Name].
      3. If the excerpts do not answer the question, say "I don't have that information in the
         provided materials" instead of speculating, and suggest where the Game Master could look.
      4. If excerpts contradict each other, present both with their citations and point out the
         discrepancy.

      Keep answers clear and concise. Use bullet points or numbered lists where they help.
      """;

  static final String UNKNOWN_PAGE = "Unknown Page";
  static final String UNTITLED_SECTION = "Untitled";

  private final AnswerProperties properties;

  public PromptBuilder(AnswerProperties properties) {
    this.properties = properties;
  }

  /**
   * Assembles the messages for one question.
   *
   * @param query the question
   * @param chunks retrieved excerpts, best first
   * @param history earlier conversation messages, oldest first; only the most recent are kept
   * @return system message, trimmed history, then the user prompt
   */
  public List<ChatMessage> build(
      String query, List<ScoredChunk> chunks, List<ConversationMessage> history) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(SYSTEM_PROMPT));
    for (ConversationMessage message : recentHistory(history)) {
      messages.add(
          message.role() == ConversationMessage.Role.USER
              ? UserMessage.from(message.content())
              : AiMessage.from(message.content()));
    }
    messages.add(UserMessage.from(userPrompt(query, chunks)));
    return messages;
  }

  List<ConversationMessage> recentHistory(List<ConversationMessage> history) {
    int keep = properties.getHistoryMessages();
    if (history.size() <= keep) {
      return history;
    }
    return history.subList(history.size() - keep, history.size());
  }

  static String userPrompt(String query, List<ScoredChunk> chunks) {
    return "QUESTION: "
        + query
        + "\n\nRELEVANT EXCERPTS:\n"
        + formatExcerpts(chunks)
        + "\n\nAnswer the question using only the excerpts above.";
  }

  static String formatExcerpts(List<ScoredChunk> chunks) {
    return IntStream.range(0, chunks.size())
        .mapToObj(i -> formatExcerpt(i + 1, chunks.get(i)))
        .collect(Collectors.joining("\n"));
  }

  private static String formatExcerpt(int rank, ScoredChunk chunk) {
    Integer pageNumber = chunk.pageNumber();
    String heading = chunk.sectionHeading();
    String page = pageNumber == null || pageNumber < 1 ? UNKNOWN_PAGE : String.valueOf(pageNumber);
    String section = heading == null || heading.isBlank() ? UNTITLED_SECTION : heading;
    return "[Excerpt "
        + rank
        + "]\nPage: "
        + page
        + "\nSection: "
        + section
        + "\nContent: "
        + chunk.content()
        + "\n---";
  }
}
