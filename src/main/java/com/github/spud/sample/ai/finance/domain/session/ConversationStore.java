package com.github.spud.sample.ai.finance.domain.session;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.stereotype.Component;

/**
 * In-memory per-caller dialogue memory. Every mutation of one caller's session goes through
 * {@link ConcurrentHashMap#compute}, so concurrent requests of the same caller never lose a
 * message. Sessions are capped and expire after a period of inactivity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationStore {

  private final ConversationProperties properties;

  private final Clock clock;

  private final Map<Long, Session> sessions = new ConcurrentHashMap<>();

  /**
   * Snapshot of the caller's messages, oldest first. Expired sessions are discarded first.
   */
  public List<ConversationMessage> getHistory(long callerId) {
    Instant now = clock.instant();
    sessions.entrySet().removeIf(entry -> isExpired(entry.getValue(), now));
    Session session = sessions.get(callerId);
    return session != null ? session.messages() : List.of();
  }

  /**
   * Tool results belong to a single run and are never remembered
   */
  public void append(long callerId, MessageType role, String content) {
    if (role == MessageType.TOOL) {
      throw new IllegalArgumentException("Tool messages are not kept in conversation history");
    }
    appendAll(callerId, List.of(new ConversationMessage(role, content)));
  }

  /**
   * Append a user message and the assistant reply as one step
   */
  public void appendTurn(long callerId, String userContent, String assistantContent) {
    appendAll(callerId, List.of(
      ConversationMessage.user(userContent),
      ConversationMessage.assistant(assistantContent)));
  }

  public void clear(long callerId) {
    if (sessions.remove(callerId) != null) {
      log.info("Cleared conversation history for caller {}", callerId);
    }
  }

  int sessionCount() {
    return sessions.size();
  }

  private void appendAll(long callerId, List<ConversationMessage> additions) {
    Instant now = clock.instant();
    sessions.compute(callerId, (id, current) -> {
      List<ConversationMessage> messages = new ArrayList<>();
      if (current != null && !isExpired(current, now)) {
        messages.addAll(current.messages());
      } else if (current != null) {
        log.debug("Conversation of caller {} expired, starting fresh", id);
      }
      messages.addAll(additions);

      int overflow = messages.size() - properties.getMaxMessages();
      if (overflow > 0) {
        messages.subList(0, overflow).clear();
      }
      return new Session(List.copyOf(messages), now);
    });
  }

  private boolean isExpired(Session session, Instant now) {
    return session.lastUpdated().plus(properties.getIdleTimeout()).isBefore(now);
  }

  private record Session(List<ConversationMessage> messages, Instant lastUpdated) {

  }
}
