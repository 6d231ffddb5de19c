package com.github.spud.sample.ai.finance.domain.agent;

import com.github.spud.sample.ai.finance.domain.state.AgentEvent;
import com.github.spud.sample.ai.finance.domain.state.AgentState;
import com.github.spud.sample.ai.finance.domain.state.StateMachineDriver;
import com.github.spud.sample.ai.finance.domain.tools.ToolExecutionService;
import com.github.spud.sample.ai.finance.domain.tools.ToolExecutionService.ToolExecutionResult;
import com.github.spud.sample.ai.finance.domain.tools.ToolRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.AssistantMessage.ToolCall;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.statemachine.StateMachine;
import org.springframework.util.StringUtils;

/**
 * Bounded tool-calling loop shared by every agent. The model is asked for a turn, tool calls are
 * dispatched through the agent's {@link ToolRegistry} and fed back, until the model answers with
 * text or the iteration budget runs out.
 */
@Slf4j
@Getter
@SuperBuilder
public abstract class BaseAgent {

  public static final String FALLBACK_RESPONSE =
    "I've processed your request but needed more iterations to complete. "
      + "Please try rephrasing your question.";

  protected String name;

  protected String description;

  protected String systemPrompt;

  protected ChatClient chatClient;

  protected ToolRegistry toolRegistry;

  protected ToolExecutionService toolExecutionService;

  protected StateMachineDriver stateMachineDriver;

  @Builder.Default
  protected List<Message> messages = new ArrayList<>();

  @Builder.Default
  protected AgentState state = AgentState.IDLE;

  @Builder.Default
  protected int currentStep = 0;

  /**
   * Checked before every completion turn; true means the caller has gone away
   */
  @Builder.Default
  protected BooleanSupplier cancellation = () -> false;

  protected AgentOutcome run(String userMessage, int maxIterations) {
    if (this.state != AgentState.IDLE) {
      throw new IllegalStateException("Cannot run agent from state: " + this.state);
    }
    if (maxIterations < 1) {
      throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
    }

    StateMachine<AgentState, AgentEvent> sm = stateMachineDriver.create(this.name);
    try {
      beforeRun();
      this.messages.add(new UserMessage(userMessage));
      transition(sm, AgentEvent.START);

      int iteration = 0;
      while (iteration < maxIterations) {
        checkCancelled();
        this.currentStep = iteration + 1;

        AssistantMessage reply = think();
        if (!reply.hasToolCalls()) {
          String text = reply.getText() != null ? reply.getText() : "";
          this.messages.add(new AssistantMessage(text));
          transition(sm, AgentEvent.FINAL_ANSWER);
          log.info("Agent '{}' answered at iteration {}/{}", this.name, this.currentStep,
            maxIterations);
          return new AgentOutcome(text, this.currentStep, false);
        }

        transition(sm, AgentEvent.TOOL_CALLS_REQUESTED);
        this.messages.add(reply);
        act(reply.getToolCalls());
        iteration++;
        transition(sm, AgentEvent.TOOLS_EXECUTED);
      }

      transition(sm, AgentEvent.BUDGET_EXHAUSTED);
      log.warn("Agent '{}' exhausted its budget of {} iterations", this.name, maxIterations);
      return new AgentOutcome(FALLBACK_RESPONSE, maxIterations, true);

    } catch (RuntimeException e) {
      if (this.state == AgentState.AWAITING_MODEL || this.state == AgentState.EXECUTING_TOOLS) {
        transition(sm, AgentEvent.FAIL);
      }
      throw e;

    } finally {
      stateMachineDriver.stop(sm);
      this.currentStep = 0;
      this.state = AgentState.IDLE;
    }
  }

  /**
   * One completion turn over the system prompt, the full history and the capability descriptors.
   * Tool execution stays with this loop, the model only proposes calls.
   */
  protected AssistantMessage think() {
    List<Message> promptMessages = new ArrayList<>();
    if (StringUtils.hasText(this.systemPrompt)) {
      promptMessages.add(new SystemMessage(this.systemPrompt));
    }
    promptMessages.addAll(this.messages);

    ToolCallingChatOptions options = ToolCallingChatOptions.builder()
      .toolCallbacks(this.toolRegistry.getAllCallbacks())
      .internalToolExecutionEnabled(false)
      .build();

    ChatResponse chatResponse;
    try {
      log.debug("Agent '{}' calling chat client with {} messages", this.name,
        promptMessages.size());
      chatResponse = this.chatClient.prompt(new Prompt(promptMessages, options))
        .call()
        .chatResponse();
    } catch (RuntimeException e) {
      log.error("Completion service call failed for agent '{}': {}", this.name, e.getMessage(), e);
      throw new CompletionServiceException(
        "Completion service call failed: " + e.getMessage(), e);
    }

    if (chatResponse == null || chatResponse.getResult() == null
      || chatResponse.getResult().getOutput() == null) {
      throw new CompletionServiceException("Completion service returned no result");
    }

    AssistantMessage reply = chatResponse.getResult().getOutput();
    log.info("Agent '{}' iteration {}: tool_calls={}", this.name, this.currentStep,
      reply.getToolCalls().size());
    return reply;
  }

  /**
   * Dispatch the calls of one turn in the order supplied. Each result becomes its own tool
   * message.
   */
  protected void act(List<ToolCall> toolCalls) {
    log.info("Agent '{}' executing {} tool call(s): {}", this.name, toolCalls.size(),
      toolCalls.stream().map(ToolCall::name).collect(Collectors.joining(", ")));

    for (ToolCall toolCall : toolCalls) {
      ToolExecutionResult result = this.toolExecutionService.execute(this.toolRegistry, toolCall);
      this.messages.add(new ToolResponseMessage(List.of(result.toToolResponse())));
      onToolResult(toolCall, result);
    }
  }

  /**
   * Called once per dispatched tool call, after its tool message is appended
   */
  protected void onToolResult(ToolCall toolCall, ToolExecutionResult result) {
  }

  /**
   * Reset per-run bookkeeping. Runs after the idle check, before the user message is appended.
   */
  protected void beforeRun() {
  }

  private void checkCancelled() {
    if (this.cancellation.getAsBoolean()) {
      log.info("Agent '{}' cancelled before iteration {}", this.name, this.currentStep + 1);
      throw new AgentCancelledException("Run cancelled for agent " + this.name);
    }
  }

  private void transition(StateMachine<AgentState, AgentEvent> sm, AgentEvent event) {
    this.state = stateMachineDriver.sendEvent(sm, event);
  }
}
