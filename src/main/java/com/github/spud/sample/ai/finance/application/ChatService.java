package com.github.spud.sample.ai.finance.application;

import com.github.spud.sample.ai.finance.domain.orchestrator.AgentActivityListener;
import com.github.spud.sample.ai.finance.domain.orchestrator.OrchestrationResult;
import com.github.spud.sample.ai.finance.domain.orchestrator.OrchestratorAgent;
import com.github.spud.sample.ai.finance.domain.session.ConversationMessageMapper;
import com.github.spud.sample.ai.finance.domain.session.ConversationStore;
import java.util.List;
import java.util.function.BooleanSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs one chat turn for a caller: remembered history in, orchestrator run, turn remembered.
 * Blocking; callers on an event loop must move it to a worker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

  private final AgentAssembler agentAssembler;

  private final ConversationStore conversationStore;

  private final ConversationMessageMapper conversationMessageMapper;

  public ChatReply chat(long userId, String message) {
    return ChatReply.from(runOrchestration(userId, message, AgentActivityListener.NO_OP,
      () -> false));
  }

  /**
   * Nothing is remembered when the run fails or is cancelled
   */
  public OrchestrationResult runOrchestration(long userId, String message,
    AgentActivityListener listener, BooleanSupplier cancellation) {
    if (!StringUtils.hasText(message)) {
      throw new IllegalArgumentException("message must not be blank");
    }

    List<Message> history = conversationMessageMapper.toSpringMessages(
      conversationStore.getHistory(userId));
    log.info("Chat request for user {} with {} remembered messages", userId, history.size());

    OrchestratorAgent orchestrator = agentAssembler.assemble(userId, history, listener,
      cancellation);
    OrchestrationResult result = orchestrator.chat(message);

    conversationStore.appendTurn(userId, message, result.response());
    return result;
  }

  public void clear(long userId) {
    conversationStore.clear(userId);
  }
}
