package com.github.spud.sample.ai.finance.domain.tools;

import static com.github.spud.sample.ai.finance.support.ChatResponses.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.finance.domain.agent.AgentCancelledException;
import com.github.spud.sample.ai.finance.domain.agent.CompletionServiceException;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccessException;
import com.github.spud.sample.ai.finance.domain.tools.ToolExecutionService.ToolExecutionResult;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.ToolResponseMessage.ToolResponse;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;

class ToolExecutionServiceTest {

  private final ToolExecutionService service = new ToolExecutionService();

  private static ToolCallback tool(String name) {
    ToolCallback callback = mock(ToolCallback.class);
    when(callback.getToolDefinition()).thenReturn(
      new DefaultToolDefinition(name, "Test tool", "{\"type\":\"object\"}"));
    return callback;
  }

  @Test
  @DisplayName("A successful call keeps the tool payload and the call id")
  void shouldReturnPayload() {
    ToolCallback summary = tool("get_account_summary");
    when(summary.call("{}")).thenReturn("[{\"account_name\":\"Main Card\"}]");

    ToolExecutionResult result = service.execute(ToolRegistry.of(List.of(summary)),
      call("call-7", "get_account_summary", "{}"));

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getPayload()).isEqualTo("[{\"account_name\":\"Main Card\"}]");

    ToolResponse response = result.toToolResponse();
    assertThat(response.id()).isEqualTo("call-7");
    assertThat(response.name()).isEqualTo("get_account_summary");
  }

  @Test
  @DisplayName("Unknown names become an error payload")
  void shouldReportUnknownFunction() {
    ToolExecutionResult result = service.execute(ToolRegistry.of(List.of()),
      call("call-1", "drop_tables", "{}"));

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getPayload()).isEqualTo("{\"error\":\"Unknown function: drop_tables\"}");
  }

  @Test
  @DisplayName("Capability and data-access failures become error payloads")
  void shouldReportCapabilityFailures() {
    ToolCallback invalid = tool("get_spending_summary");
    when(invalid.call(any())).thenThrow(new CapabilityException("Invalid date '2024-13-01'"));
    ToolCallback broken = tool("get_savings_summary");
    when(broken.call(any())).thenThrow(new FinanceDataAccessException("connection refused"));
    ToolRegistry registry = ToolRegistry.of(List.of(invalid, broken));

    ToolExecutionResult first = service.execute(registry,
      call("call-1", "get_spending_summary", "{}"));
    ToolExecutionResult second = service.execute(registry,
      call("call-2", "get_savings_summary", "{}"));

    assertThat(first.getPayload()).isEqualTo("{\"error\":\"Invalid date '2024-13-01'\"}");
    assertThat(second.isSuccess()).isFalse();
    assertThat(second.getError()).isEqualTo("connection refused");
  }

  @Test
  @DisplayName("Completion-service failures and cancellation are not swallowed")
  void shouldRethrowAbortingFailures() {
    ToolCallback upstream = tool("consult_analytics_agent");
    when(upstream.call(any())).thenThrow(new CompletionServiceException("timeout"));
    ToolCallback cancelled = tool("consult_advisor_agent");
    when(cancelled.call(any())).thenThrow(new AgentCancelledException("gone"));
    ToolRegistry registry = ToolRegistry.of(List.of(upstream, cancelled));

    assertThatThrownBy(() -> service.execute(registry,
      call("call-1", "consult_analytics_agent", "{}")))
      .isInstanceOf(CompletionServiceException.class);
    assertThatThrownBy(() -> service.execute(registry,
      call("call-2", "consult_advisor_agent", "{}")))
      .isInstanceOf(AgentCancelledException.class);
  }

  @Test
  @DisplayName("Registry rejects duplicate names and keeps registration order")
  void registryShouldKeepOrderAndRejectDuplicates() {
    ToolRegistry registry = ToolRegistry.of(List.of(tool("b_tool"), tool("a_tool")));

    assertThat(registry.getToolNames()).containsExactly("b_tool", "a_tool");
    assertThat(registry.hasToolByName("a_tool")).isTrue();
    assertThat(registry.getCallback(null)).isEmpty();
    assertThatThrownBy(() -> registry.register(tool("a_tool")))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("Duplicate tool name: a_tool");
  }
}
