package com.github.spud.sample.ai.finance.domain.session;

import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;

/**
 * Converts remembered messages into Spring AI messages for the orchestrator's history
 */
@Component
public class ConversationMessageMapper {

  public List<Message> toSpringMessages(List<ConversationMessage> history) {
    List<Message> messages = new ArrayList<>(history.size());
    for (ConversationMessage message : history) {
      messages.add(toSpringMessage(message));
    }
    return messages;
  }

  public Message toSpringMessage(ConversationMessage message) {
    return switch (message.role()) {
      case USER -> new UserMessage(message.content());
      case ASSISTANT -> new AssistantMessage(message.content());
      case SYSTEM -> new SystemMessage(message.content());
      case TOOL -> throw new IllegalArgumentException(
        "Tool messages are not kept in conversation history");
    };
  }
}
