package com.github.spud.sample.ai.finance.domain.session;

import java.util.Objects;
import org.springframework.ai.chat.messages.MessageType;

/**
 * One remembered message of a caller's dialogue
 */
public record ConversationMessage(MessageType role, String content) {

  public ConversationMessage {
    Objects.requireNonNull(role, "role");
    content = content != null ? content : "";
  }

  public static ConversationMessage user(String content) {
    return new ConversationMessage(MessageType.USER, content);
  }

  public static ConversationMessage assistant(String content) {
    return new ConversationMessage(MessageType.ASSISTANT, content);
  }
}
