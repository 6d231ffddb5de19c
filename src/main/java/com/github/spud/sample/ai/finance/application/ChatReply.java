package com.github.spud.sample.ai.finance.application;

import com.github.spud.sample.ai.finance.domain.orchestrator.DelegationRecord;
import com.github.spud.sample.ai.finance.domain.orchestrator.OrchestrationResult;
import java.util.List;

/**
 * Outcome of one synchronous chat request
 */
public record ChatReply(String response, List<String> agentsConsulted,
                        List<DelegationRecord> agentTimeline, int iterations) {

  public static ChatReply from(OrchestrationResult result) {
    return new ChatReply(result.response(), result.agentsConsulted(), result.timeline(),
      result.iterations());
  }
}
