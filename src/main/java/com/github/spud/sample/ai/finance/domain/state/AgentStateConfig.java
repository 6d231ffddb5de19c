package com.github.spud.sample.ai.finance.domain.state;

import java.util.EnumSet;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

/**
 * Transition table of the agent loop
 * <pre>
 *   IDLE --(START)--> AWAITING_MODEL
 *   AWAITING_MODEL --(TOOL_CALLS_REQUESTED)--> EXECUTING_TOOLS
 *   EXECUTING_TOOLS --(TOOLS_EXECUTED)--> AWAITING_MODEL
 *   AWAITING_MODEL --(FINAL_ANSWER)--> DONE
 *   AWAITING_MODEL --(BUDGET_EXHAUSTED)--> EXHAUSTED
 *   AWAITING_MODEL --(FAIL)--> ERROR
 *   EXECUTING_TOOLS --(FAIL)--> ERROR
 * </pre>
 * One machine is taken from the factory per {@code chat()} call by {@link StateMachineDriver}.
 */
@Configuration
@EnableStateMachineFactory
public class AgentStateConfig extends EnumStateMachineConfigurerAdapter<AgentState, AgentEvent> {

  @Override
  public void configure(StateMachineConfigurationConfigurer<AgentState, AgentEvent> config)
    throws Exception {
    config
      .withConfiguration()
      .autoStartup(false);
  }

  @Override
  public void configure(StateMachineStateConfigurer<AgentState, AgentEvent> states)
    throws Exception {
    states
      .withStates()
      .initial(AgentState.IDLE)
      .states(EnumSet.allOf(AgentState.class))
      .end(AgentState.DONE)
      .end(AgentState.EXHAUSTED)
      .end(AgentState.ERROR);
  }

  @Override
  public void configure(StateMachineTransitionConfigurer<AgentState, AgentEvent> transitions)
    throws Exception {
    transitions
      .withExternal()
      .source(AgentState.IDLE).target(AgentState.AWAITING_MODEL)
      .event(AgentEvent.START)
      .and()

      .withExternal()
      .source(AgentState.AWAITING_MODEL).target(AgentState.EXECUTING_TOOLS)
      .event(AgentEvent.TOOL_CALLS_REQUESTED)
      .and()

      .withExternal()
      .source(AgentState.EXECUTING_TOOLS).target(AgentState.AWAITING_MODEL)
      .event(AgentEvent.TOOLS_EXECUTED)
      .and()

      .withExternal()
      .source(AgentState.AWAITING_MODEL).target(AgentState.DONE)
      .event(AgentEvent.FINAL_ANSWER)
      .and()

      .withExternal()
      .source(AgentState.AWAITING_MODEL).target(AgentState.EXHAUSTED)
      .event(AgentEvent.BUDGET_EXHAUSTED)
      .and()

      .withExternal()
      .source(AgentState.AWAITING_MODEL).target(AgentState.ERROR)
      .event(AgentEvent.FAIL)
      .and()
      .withExternal()
      .source(AgentState.EXECUTING_TOOLS).target(AgentState.ERROR)
      .event(AgentEvent.FAIL);
  }
}
