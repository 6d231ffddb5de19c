package com.github.spud.sample.ai.finance.domain.orchestrator;

import java.util.List;

/**
 * @param response final text, or the fallback text when the orchestrator ran out of iterations
 * @param agentsConsulted specialists consulted, deduplicated, in first-seen order
 * @param timeline every completed delegation in execution order
 * @param iterations completion turns taken by the orchestrator
 */
public record OrchestrationResult(String response, List<String> agentsConsulted,
                                  List<DelegationRecord> timeline, int iterations) {

  public OrchestrationResult {
    agentsConsulted = List.copyOf(agentsConsulted);
    timeline = List.copyOf(timeline);
  }
}
