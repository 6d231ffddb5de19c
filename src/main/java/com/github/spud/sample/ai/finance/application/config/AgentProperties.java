package com.github.spud.sample.ai.finance.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Iteration budgets and identity of the agent graph
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "finance.agent")
public class AgentProperties {

  /**
   * Maximum number of completion turns the orchestrator may take per request
   */
  private int maxIterations = 5;

  /**
   * Maximum number of completion turns a specialist may take per delegation
   */
  private int specialistMaxIterations = 5;

  /**
   * Name reported in the {@code start} frame and used in the orchestrator's system prompt
   */
  private String orchestratorName = "Orchestrator";

  /**
   * Currency assumed when the user profile does not define one
   */
  private String defaultCurrency = "SEK";
}
