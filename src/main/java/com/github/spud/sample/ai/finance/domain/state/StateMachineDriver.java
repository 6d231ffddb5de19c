package com.github.spud.sample.ai.finance.domain.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Adapter between the agent loop and Spring StateMachine
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateMachineDriver {

  private final StateMachineFactory<AgentState, AgentEvent> stateMachineFactory;

  /**
   * Start a fresh machine for one loop run
   */
  public StateMachine<AgentState, AgentEvent> create(String machineId) {
    StateMachine<AgentState, AgentEvent> sm = stateMachineFactory.getStateMachine(machineId);
    sm.startReactively().block();
    log.debug("State machine started for {}", machineId);
    return sm;
  }

  public AgentState getCurrentState(StateMachine<AgentState, AgentEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * Send an event and wait for the transition. A rejected event means the loop broke its own
   * transition table.
   */
  public AgentState sendEvent(StateMachine<AgentState, AgentEvent> sm, AgentEvent event) {
    AgentState from = getCurrentState(sm);
    StateMachineEventResult<AgentState, AgentEvent> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
      .blockFirst();

    boolean accepted = result != null
      && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;
    if (!accepted) {
      throw new IllegalStateException("Event " + event + " rejected in state " + from);
    }

    AgentState to = getCurrentState(sm);
    log.debug("{}: {} --({})--> {}", sm.getId(), from, event, to);
    return to;
  }

  public void stop(StateMachine<AgentState, AgentEvent> sm) {
    sm.stopReactively().block();
  }

  public boolean isInFinalState(StateMachine<AgentState, AgentEvent> sm) {
    return AgentState.isFinal(getCurrentState(sm));
  }
}
