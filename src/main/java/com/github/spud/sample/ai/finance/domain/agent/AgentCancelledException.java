package com.github.spud.sample.ai.finance.domain.agent;

/**
 * The caller went away while the run was still in progress.
 */
public class AgentCancelledException extends RuntimeException {

  public AgentCancelledException(String message) {
    super(message);
  }
}
