package com.github.spud.sample.ai.finance.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.finance.domain.agent.CompletionServiceException;
import com.github.spud.sample.ai.finance.domain.orchestrator.DelegationRecord;
import com.github.spud.sample.ai.finance.domain.orchestrator.OrchestrationResult;
import com.github.spud.sample.ai.finance.domain.orchestrator.OrchestratorAgent;
import com.github.spud.sample.ai.finance.domain.session.ConversationMessage;
import com.github.spud.sample.ai.finance.domain.session.ConversationMessageMapper;
import com.github.spud.sample.ai.finance.domain.session.ConversationProperties;
import com.github.spud.sample.ai.finance.domain.session.ConversationStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.Message;

@ExtendWith(MockitoExtension.class)
class ChatServiceTest {

  @Mock
  private AgentAssembler agentAssembler;

  @Mock
  private OrchestratorAgent orchestrator;

  private ConversationStore conversationStore;

  private ChatService chatService;

  @BeforeEach
  void setUp() {
    conversationStore = new ConversationStore(new ConversationProperties(),
      Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC));
    chatService = new ChatService(agentAssembler, conversationStore,
      new ConversationMessageMapper());
  }

  @Test
  @DisplayName("A blank message is rejected before any agent is built")
  void shouldRejectBlankMessage() {
    assertThatThrownBy(() -> chatService.chat(1L, "  "))
      .isInstanceOf(IllegalArgumentException.class);
    verify(agentAssembler, never()).assemble(anyLong(), any(), any(), any());
  }

  @Test
  @DisplayName("A successful turn is remembered and fed back as history on the next request")
  void shouldRememberSuccessfulTurns() {
    when(agentAssembler.assemble(eq(1L), any(), any(), any())).thenReturn(orchestrator);
    when(orchestrator.chat("How much did I spend?")).thenReturn(new OrchestrationResult(
      "You spent 1550.75 SEK.", List.of("Analytics Agent"),
      List.of(DelegationRecord.completed("Analytics Agent", 1)), 2));
    when(orchestrator.chat("And savings?")).thenReturn(new OrchestrationResult(
      "18600.00 SEK in total.", List.of(), List.of(), 1));

    ChatReply reply = chatService.chat(1L, "How much did I spend?");
    chatService.chat(1L, "And savings?");

    assertThat(reply.response()).isEqualTo("You spent 1550.75 SEK.");
    assertThat(reply.agentsConsulted()).containsExactly("Analytics Agent");
    assertThat(reply.agentTimeline()).hasSize(1);
    assertThat(reply.iterations()).isEqualTo(2);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<Message>> history = ArgumentCaptor.forClass(List.class);
    verify(agentAssembler, times(2))
      .assemble(eq(1L), history.capture(), any(), any());
    assertThat(history.getAllValues().get(0)).isEmpty();
    assertThat(history.getAllValues().get(1)).extracting(Message::getText)
      .containsExactly("How much did I spend?", "You spent 1550.75 SEK.");

    assertThat(conversationStore.getHistory(1L)).hasSize(4)
      .endsWith(ConversationMessage.user("And savings?"),
        ConversationMessage.assistant("18600.00 SEK in total."));
  }

  @Test
  @DisplayName("Nothing is remembered when the run fails")
  void shouldNotRememberFailedTurns() {
    when(agentAssembler.assemble(eq(1L), any(), any(), any())).thenReturn(orchestrator);
    when(orchestrator.chat("Hi"))
      .thenThrow(new CompletionServiceException("Completion service call failed: timeout"));

    assertThatThrownBy(() -> chatService.chat(1L, "Hi"))
      .isInstanceOf(CompletionServiceException.class);
    assertThat(conversationStore.getHistory(1L)).isEmpty();
  }

  @Test
  @DisplayName("Clearing drops the remembered history")
  void shouldClearHistory() {
    conversationStore.appendTurn(1L, "Hi", "Hello");

    chatService.clear(1L);

    assertThat(conversationStore.getHistory(1L)).isEmpty();
  }
}
