package com.github.spud.sample.ai.finance.application.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.spud.sample.ai.finance.domain.orchestrator.OrchestrationResult;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One frame of the streaming protocol. Frames are sent in order: {@code start}, any number of
 * {@code agent-activity}, then {@code response} and {@code done}, or a single {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentStreamEvent {

  public static final String START = "start";
  public static final String AGENT_ACTIVITY = "agent-activity";
  public static final String RESPONSE = "response";
  public static final String DONE = "done";
  public static final String ERROR = "error";

  private String type;

  private String agent;

  private Map<String, Object> data;

  private String response;

  @JsonProperty("agents_consulted")
  private List<String> agentsConsulted;

  private Integer iterations;

  private String error;

  public static AgentStreamEvent start(String agent) {
    return AgentStreamEvent.builder().type(START).agent(agent).build();
  }

  public static AgentStreamEvent activity(String agent, Map<String, Object> data) {
    return AgentStreamEvent.builder()
      .type(AGENT_ACTIVITY)
      .agent(agent)
      .data(data != null ? data : Map.of())
      .build();
  }

  public static AgentStreamEvent response(OrchestrationResult result) {
    return AgentStreamEvent.builder()
      .type(RESPONSE)
      .response(result.response())
      .agentsConsulted(result.agentsConsulted())
      .iterations(result.iterations())
      .build();
  }

  public static AgentStreamEvent done() {
    return AgentStreamEvent.builder().type(DONE).build();
  }

  public static AgentStreamEvent error(String message) {
    return AgentStreamEvent.builder()
      .type(ERROR)
      .error(message != null ? message : "Unknown error")
      .build();
  }
}
