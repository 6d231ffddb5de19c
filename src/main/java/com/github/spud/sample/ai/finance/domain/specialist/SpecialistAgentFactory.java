package com.github.spud.sample.ai.finance.domain.specialist;

import com.github.spud.sample.ai.finance.application.config.AgentProperties;
import com.github.spud.sample.ai.finance.domain.agent.ToolCallAgent;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.UserProfile;
import com.github.spud.sample.ai.finance.domain.state.StateMachineDriver;
import com.github.spud.sample.ai.finance.domain.tools.ToolExecutionService;
import com.github.spud.sample.ai.finance.domain.tools.ToolRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;

/**
 * Builds the per-request specialist agents, each bound to one user and a fixed capability subset
 */
@Component
@RequiredArgsConstructor
public class SpecialistAgentFactory {

  public static final String ANALYTICS_AGENT_NAME = "Analytics Agent";

  public static final String ADVISOR_AGENT_NAME = "Advisor Agent";

  private final ChatClient chatClient;

  private final ToolExecutionService toolExecutionService;

  private final StateMachineDriver stateMachineDriver;

  private final FinanceCapabilities financeCapabilities;

  private final UserContextPrompt userContextPrompt;

  private final AgentProperties agentProperties;

  public ToolCallAgent analyticsAgent(long userId, Optional<UserProfile> profile,
    BooleanSupplier cancellation) {
    String name = userContextPrompt.fullName(profile);
    String currency = userContextPrompt.currency(profile);
    String instructions = """
      You are an expert data analyst for %s's personal financial tracking system.

      Your responsibilities:
      - Analyze spending patterns and trends
      - Provide detailed breakdowns by categories, accounts and time periods
      - Answer questions about the database structure
      - Consider household context (family size, vehicles, housing) in your insights

      You can only READ data. You cannot create, update or delete anything.

      When answering:
      1. Call get_user_profile first to refresh the user context
      2. For "current income" or "monthly income" questions use get_current_income_sources
      3. For historical income use get_income_summary with month="YYYY-MM"
      4. Present findings clearly and concisely
      5. Always display amounts in %s
      """.formatted(name, currency);

    return build(ANALYTICS_AGENT_NAME, "Database and Data Analysis Expert",
      userContextPrompt.userContext(profile) + "\n" + instructions,
      financeCapabilities.analyticsCapabilities(userId), cancellation);
  }

  public ToolCallAgent advisorAgent(long userId, Optional<UserProfile> profile,
    BooleanSupplier cancellation) {
    String name = userContextPrompt.fullName(profile);
    String currency = userContextPrompt.currency(profile);
    String instructions = """
      You are %s's personal financial advisor specializing in budgeting, savings and financial
      wellness.

      Your responsibilities:
      - Analyze financial health and give actionable advice
      - Suggest budget optimizations and spending improvements
      - Help reach the savings goals
      - Compare income against expenses

      You can only READ data. You cannot create, update or delete anything.

      Your approach:
      1. Call get_user_profile first to refresh the user context
      2. Gather the relevant data, starting with get_financial_health_metrics
      3. Give specific, prioritized recommendations that fit the household
      4. Address the user by name and use %s for all amounts
      """.formatted(name, currency);

    return build(ADVISOR_AGENT_NAME, "Personal Finance Advisor",
      userContextPrompt.userContext(profile) + "\n" + instructions,
      financeCapabilities.advisorCapabilities(userId), cancellation);
  }

  private ToolCallAgent build(String name, String role, String instructions,
    List<ToolCallback> capabilities, BooleanSupplier cancellation) {
    return ToolCallAgent.builder()
      .name(name)
      .description(role)
      .systemPrompt("You are " + name + ", a " + role + ".\n\n" + instructions)
      .chatClient(chatClient)
      .toolRegistry(ToolRegistry.of(capabilities))
      .toolExecutionService(toolExecutionService)
      .stateMachineDriver(stateMachineDriver)
      .messages(new ArrayList<>())
      .cancellation(cancellation)
      .maxIterations(agentProperties.getSpecialistMaxIterations())
      .build();
  }
}
