package com.github.spud.sample.ai.finance.domain.orchestrator;

import com.github.spud.sample.ai.finance.domain.agent.AgentOutcome;
import com.github.spud.sample.ai.finance.domain.agent.BaseAgent;
import com.github.spud.sample.ai.finance.domain.tools.ToolExecutionService.ToolExecutionResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage.ToolCall;

/**
 * Coordinator agent. Its capabilities are one {@link DelegationToolCallback} per specialist; it
 * tracks which specialists were consulted and when.
 */
@Slf4j
@Getter
@SuperBuilder
public class OrchestratorAgent extends BaseAgent {

  @Builder.Default
  private int maxIterations = 5;

  @Builder.Default
  private AgentActivityListener activityListener = AgentActivityListener.NO_OP;

  @Getter(AccessLevel.NONE)
  @Builder.Default
  private final Set<String> agentsConsulted = new LinkedHashSet<>();

  @Getter(AccessLevel.NONE)
  @Builder.Default
  private final List<DelegationRecord> timeline = new ArrayList<>();

  public OrchestrationResult chat(String userMessage) {
    return chat(userMessage, this.maxIterations);
  }

  public OrchestrationResult chat(String userMessage, int maxIterations) {
    AgentOutcome outcome = run(userMessage, maxIterations);
    log.info("Orchestration finished: iterations={}, exhausted={}, consulted={}",
      outcome.iterations(), outcome.exhausted(), this.agentsConsulted);
    return new OrchestrationResult(outcome.text(), new ArrayList<>(this.agentsConsulted),
      this.timeline, outcome.iterations());
  }

  @Override
  protected void beforeRun() {
    this.agentsConsulted.clear();
    this.timeline.clear();
  }

  @Override
  protected void onToolResult(ToolCall toolCall, ToolExecutionResult result) {
    if (!result.isSuccess()) {
      return;
    }
    this.toolRegistry.getCallback(toolCall.name())
      .filter(DelegationToolCallback.class::isInstance)
      .map(DelegationToolCallback.class::cast)
      .ifPresent(delegation -> recordDelegation(delegation.getAgentName()));
  }

  private void recordDelegation(String agent) {
    int iteration = getCurrentStep();
    this.agentsConsulted.add(agent);
    this.timeline.add(DelegationRecord.completed(agent, iteration));

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("iteration", iteration);
    data.put("status", DelegationRecord.COMPLETED);
    this.activityListener.onAgentActivity(agent, data);
  }
}
