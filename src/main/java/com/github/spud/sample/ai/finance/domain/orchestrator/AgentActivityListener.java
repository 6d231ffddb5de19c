package com.github.spud.sample.ai.finance.domain.orchestrator;

import java.util.Map;

/**
 * Notified on the orchestrating thread each time a delegation completes
 */
@FunctionalInterface
public interface AgentActivityListener {

  AgentActivityListener NO_OP = (agent, data) -> {
  };

  void onAgentActivity(String agent, Map<String, Object> data);
}
