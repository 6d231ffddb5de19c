package com.github.spud.sample.ai.finance.domain.agent;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

/**
 * A capability-bound agent that answers with plain text
 */
@Getter
@SuperBuilder
public class ToolCallAgent extends BaseAgent {

  public static final int DEFAULT_MAX_ITERATIONS = 5;

  @Builder.Default
  private int maxIterations = DEFAULT_MAX_ITERATIONS;

  public String chat(String userMessage) {
    return chat(userMessage, this.maxIterations);
  }

  /**
   * Run the loop for one user message. Never raises on budget exhaustion: the fallback text is
   * returned instead.
   */
  public String chat(String userMessage, int maxIterations) {
    return run(userMessage, maxIterations).text();
  }
}
