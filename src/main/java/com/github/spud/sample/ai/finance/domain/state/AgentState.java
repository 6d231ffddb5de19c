package com.github.spud.sample.ai.finance.domain.state;

/**
 * States of one agent's tool-calling loop
 * <pre>
 * IDLE → AWAITING_MODEL → EXECUTING_TOOLS → AWAITING_MODEL (loop)
 *                       → DONE
 *                       → EXHAUSTED
 *                       → ERROR
 * </pre>
 */
public enum AgentState {
  /**
   * Not running a loop
   */
  IDLE,

  /**
   * Waiting on the completion service
   */
  AWAITING_MODEL,

  /**
   * Dispatching the tool calls of the last turn
   */
  EXECUTING_TOOLS,

  /**
   * Final text returned (terminal)
   */
  DONE,

  /**
   * Iteration budget used up, fallback returned (terminal)
   */
  EXHAUSTED,

  /**
   * Completion service failed or the run was cancelled (terminal)
   */
  ERROR;

  public static boolean isFinal(AgentState state) {
    return state == DONE || state == EXHAUSTED || state == ERROR;
  }
}
