package com.github.spud.sample.ai.finance.domain.state;

/**
 * Events driving the agent loop state machine
 */
public enum AgentEvent {
  /**
   * User message appended, first request about to be sent
   */
  START,

  /**
   * Completion service answered with one or more tool calls
   */
  TOOL_CALLS_REQUESTED,

  /**
   * Every tool call of the turn has a tool message
   */
  TOOLS_EXECUTED,

  /**
   * Completion service answered with text only
   */
  FINAL_ANSWER,

  /**
   * Iteration budget reached without a final answer
   */
  BUDGET_EXHAUSTED,

  /**
   * Upstream failure or cancellation
   */
  FAIL
}
