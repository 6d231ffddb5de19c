package com.github.spud.sample.ai.finance.domain.orchestrator;

/**
 * One completed delegation
 *
 * @param agent specialist name
 * @param iteration orchestrator iteration (1-based) in which the delegation ran
 * @param status always {@code completed}; failed delegations are not recorded
 */
public record DelegationRecord(String agent, int iteration, String status) {

  public static final String COMPLETED = "completed";

  public static DelegationRecord completed(String agent, int iteration) {
    return new DelegationRecord(agent, iteration, COMPLETED);
  }
}
