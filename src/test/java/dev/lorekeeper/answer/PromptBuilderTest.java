package dev.lorekeeper.answer;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.lorekeeper.search.MatchSource;
import dev.lorekeeper.search.ScoredChunk;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

class PromptBuilderTest {

  private final PromptBuilder promptBuilder = new PromptBuilder(new AnswerProperties());

  static ScoredChunk excerpt(String content, @Nullable Integer page, @Nullable String heading) {
    return new ScoredChunk(
        UUID.randomUUID(),
        UUID.randomUUID(),
        content,
        page,
        heading,
        "players-handbook.pdf",
        0.03,
        MatchSource.HYBRID);
  }

  // --- Excerpt formatting ---

  @Test
  void excerptsAreNumberedWithPageAndSection() {
    String formatted =
        PromptBuilder.formatExcerpts(
            List.of(
                excerpt("Grappling uses Athletics.", 42, "Combat"),
                excerpt("Fireball deals 8d6.", 7, "Spells")));

    assertThat(formatted)
        .isEqualTo(
            "[Excerpt 1]\nPage: 42\nSection: Combat\nContent: Grappling uses Athletics.\n---\n"
                + "[Excerpt 2]\nPage: 7\nSection: Spells\nContent: Fireball deals 8d6.\n---");
  }

  @Test
  void missingPageAndHeadingUsePlaceholders() {
    String formatted =
        PromptBuilder.formatExcerpts(
            List.of(excerpt("No page.", null, null), excerpt("Zero page.", 0, "  ")));

    assertThat(formatted)
        .contains("[Excerpt 1]\nPage: Unknown Page\nSection: Untitled\n")
        .contains("[Excerpt 2]\nPage: Unknown Page\nSection: Untitled\n");
  }

  @Test
  void userPromptWrapsQuestionAndExcerpts() {
    String prompt =
        PromptBuilder.userPrompt(
            "How does grappling work?", List.of(excerpt("Use Athletics.", 3, "Combat")));

    assertThat(prompt)
        .startsWith("QUESTION: How does grappling work?\n\nRELEVANT EXCERPTS:\n[Excerpt 1]\n")
        .endsWith("---\n\nAnswer the question using only the excerpts above.");
  }

  // --- Message assembly ---

  @Test
  void messagesAreSystemThenUserPrompt() {
    List<ChatMessage> messages =
        promptBuilder.build(
            "What is a saving throw?", List.of(excerpt("A d20 roll.", 1, "Rules")), List.of());

    assertThat(messages).hasSize(2);
    assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
    assertThat(((SystemMessage) messages.get(0)).text()).isEqualTo(PromptBuilder.SYSTEM_PROMPT);
    assertThat(((UserMessage) messages.get(1)).singleText())
        .startsWith("QUESTION: What is a saving throw?");
  }

  @Test
  void onlyTheMostRecentHistoryIsKeptInOrder() {
    List<ConversationMessage> history =
        List.of(
            new ConversationMessage(ConversationMessage.Role.USER, "first question"),
            new ConversationMessage(ConversationMessage.Role.ASSISTANT, "first answer"),
            new ConversationMessage(ConversationMessage.Role.USER, "second question"),
            new ConversationMessage(ConversationMessage.Role.ASSISTANT, "second answer"),
            new ConversationMessage(ConversationMessage.Role.USER, "third question"),
            new ConversationMessage(ConversationMessage.Role.ASSISTANT, "third answer"));

    List<ChatMessage> messages =
        promptBuilder.build("follow-up?", List.of(excerpt("Text.", 1, "Rules")), history);

    assertThat(messages).hasSize(6);
    assertThat(((UserMessage) messages.get(1)).singleText()).isEqualTo("second question");
    assertThat(((AiMessage) messages.get(2)).text()).isEqualTo("second answer");
    assertThat(((AiMessage) messages.get(4)).text()).isEqualTo("third answer");
    assertThat(messages.get(5)).isInstanceOf(UserMessage.class);
  }

  @Test
  void systemPromptDemandsCitationsAndAdmittingMissingInformation() {
    assertThat(PromptBuilder.SYSTEM_PROMPT)
        .contains("[Page X, Section Name]")
        .contains("I don't have that information in the")
        .contains("contradict");
  }
}
