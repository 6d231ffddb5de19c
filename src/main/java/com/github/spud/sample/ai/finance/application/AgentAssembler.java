package com.github.spud.sample.ai.finance.application;

import com.github.spud.sample.ai.finance.application.config.AgentProperties;
import com.github.spud.sample.ai.finance.domain.agent.ToolCallAgent;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.UserProfile;
import com.github.spud.sample.ai.finance.domain.orchestrator.AgentActivityListener;
import com.github.spud.sample.ai.finance.domain.orchestrator.DelegationToolCallback;
import com.github.spud.sample.ai.finance.domain.orchestrator.OrchestratorAgent;
import com.github.spud.sample.ai.finance.domain.specialist.SpecialistAgentFactory;
import com.github.spud.sample.ai.finance.domain.specialist.UserContextPrompt;
import com.github.spud.sample.ai.finance.domain.state.StateMachineDriver;
import com.github.spud.sample.ai.finance.domain.tools.ToolExecutionService;
import com.github.spud.sample.ai.finance.domain.tools.ToolRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.stereotype.Component;

/**
 * Wires one request's agent graph: the orchestrator and its specialists, all bound to the caller
 * and sharing one cancellation flag
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentAssembler {

  private final ChatClient chatClient;

  private final ToolExecutionService toolExecutionService;

  private final StateMachineDriver stateMachineDriver;

  private final SpecialistAgentFactory specialistAgentFactory;

  private final UserContextPrompt userContextPrompt;

  private final FinanceDataAccess financeDataAccess;

  private final AgentProperties agentProperties;

  public OrchestratorAgent assemble(long userId, List<Message> history,
    AgentActivityListener listener, BooleanSupplier cancellation) {
    Optional<UserProfile> profile = financeDataAccess.getUserProfile(userId);
    if (profile.isEmpty()) {
      log.warn("No profile for user {}, using defaults in prompts", userId);
    }

    ToolCallAgent analytics = specialistAgentFactory.analyticsAgent(userId, profile, cancellation);
    ToolCallAgent advisor = specialistAgentFactory.advisorAgent(userId, profile, cancellation);

    List<DelegationToolCallback> delegations = List.of(
      new DelegationToolCallback(analytics,
        "Consult the " + analytics.getName() + " for data analysis, spending patterns, "
          + "breakdowns and trends"),
      new DelegationToolCallback(advisor,
        "Consult the " + advisor.getName() + " for budget advice, savings optimization "
          + "and financial recommendations"));

    return OrchestratorAgent.builder()
      .name(agentProperties.getOrchestratorName())
      .description("Intelligent Query Router and Coordinator")
      .systemPrompt(orchestratorPrompt(profile, analytics, advisor))
      .chatClient(chatClient)
      .toolRegistry(ToolRegistry.of(delegations))
      .toolExecutionService(toolExecutionService)
      .stateMachineDriver(stateMachineDriver)
      .messages(new ArrayList<>(history))
      .cancellation(cancellation)
      .activityListener(listener != null ? listener : AgentActivityListener.NO_OP)
      .maxIterations(agentProperties.getMaxIterations())
      .build();
  }

  private String orchestratorPrompt(Optional<UserProfile> profile, ToolCallAgent analytics,
    ToolCallAgent advisor) {
    String analyticsTool = DelegationToolCallback.toolName(analytics.getName());
    String advisorTool = DelegationToolCallback.toolName(advisor.getName());
    return """
      You are %s, the coordinator of a multi-agent personal finance assistant.

      %s
      Your role:
      - Understand the user's question and decide which agent(s) to consult
      - Route data and analysis questions to the %s (%s)
      - Route advice and recommendation questions to the %s (%s)
      - Consult both when a question needs data and advice
      - Answer greetings and simple questions directly without consulting anyone

      When consulting agents, ask each one a clear, specific question, then combine their answers
      into one friendly reply. Address the user by name and use %s for all amounts.
      """.formatted(
      agentProperties.getOrchestratorName(),
      userContextPrompt.orchestratorContext(profile),
      analytics.getName(), analyticsTool,
      advisor.getName(), advisorTool,
      userContextPrompt.currency(profile));
  }
}
