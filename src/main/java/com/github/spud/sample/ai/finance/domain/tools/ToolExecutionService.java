package com.github.spud.sample.ai.finance.domain.tools;

import com.github.spud.sample.ai.finance.domain.agent.AgentCancelledException;
import com.github.spud.sample.ai.finance.domain.agent.CompletionServiceException;
import com.github.spud.sample.ai.finance.util.JsonUtils;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage.ToolCall;
import org.springframework.ai.chat.messages.ToolResponseMessage.ToolResponse;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Service;

/**
 * Dispatches one tool call against an agent's registry and always returns a structured result.
 * Only completion-service failures and cancellation escape.
 */
@Slf4j
@Service
public class ToolExecutionService {

  public ToolExecutionResult execute(ToolRegistry toolRegistry, ToolCall toolCall) {
    long startTime = System.currentTimeMillis();
    String toolName = toolCall.name();
    String arguments = toolCall.arguments();

    try {
      ToolCallback callback = toolRegistry.getCallback(toolName)
        .orElseThrow(() -> new ToolNotFoundException("Unknown function: " + toolName));

      log.debug("Executing tool: {} with args: {}", toolName, arguments);
      String payload = callback.call(arguments);

      long duration = System.currentTimeMillis() - startTime;
      log.info("Tool {} completed in {}ms", toolName, duration);

      return ToolExecutionResult.builder()
        .toolCallId(toolCall.id())
        .toolName(toolName)
        .arguments(arguments)
        .payload(payload)
        .success(true)
        .durationMs(duration)
        .build();

    } catch (CompletionServiceException | AgentCancelledException e) {
      throw e;

    } catch (ToolNotFoundException e) {
      log.warn("Tool not found: {}", toolName);
      return failure(toolCall, e.getMessage(), startTime);

    } catch (CapabilityException e) {
      log.warn("Tool {} rejected: {}", toolName, e.getMessage());
      return failure(toolCall, e.getMessage(), startTime);

    } catch (Exception e) {
      log.error("Tool execution failed: {} - {}", toolName, e.getMessage(), e);
      return failure(toolCall, e.getMessage(), startTime);
    }
  }

  private ToolExecutionResult failure(ToolCall toolCall, String error, long startTime) {
    return ToolExecutionResult.builder()
      .toolCallId(toolCall.id())
      .toolName(toolCall.name())
      .arguments(toolCall.arguments())
      .payload(JsonUtils.errorPayload(error))
      .success(false)
      .error(error)
      .durationMs(System.currentTimeMillis() - startTime)
      .build();
  }

  @Data
  @Builder
  public static class ToolExecutionResult {

    private String toolCallId;
    private String toolName;
    private String arguments;
    private String payload;
    private boolean success;
    private String error;
    private long durationMs;

    public ToolResponse toToolResponse() {
      return new ToolResponse(toolCallId, toolName, payload);
    }
  }

  public static class ToolNotFoundException extends RuntimeException {

    public ToolNotFoundException(String message) {
      super(message);
    }
  }
}
