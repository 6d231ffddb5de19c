package com.github.spud.sample.ai.finance.domain.session;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retention policy of the in-memory conversation store
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "finance.agent.conversation")
public class ConversationProperties {

  /**
   * Messages kept per caller; the oldest are dropped first
   */
  private int maxMessages = 20;

  /**
   * A session untouched for longer than this is discarded on next access
   */
  private Duration idleTimeout = Duration.ofMinutes(30);
}
