package com.github.spud.sample.ai.finance.interfaces.rest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.spud.sample.ai.finance.application.ChatReply;
import com.github.spud.sample.ai.finance.application.ChatService;
import com.github.spud.sample.ai.finance.application.config.AgentProperties;
import com.github.spud.sample.ai.finance.application.stream.AgentStreamEvent;
import com.github.spud.sample.ai.finance.application.stream.OrchestrationStreamBridge;
import com.github.spud.sample.ai.finance.domain.orchestrator.DelegationRecord;
import com.github.spud.sample.ai.finance.domain.specialist.SpecialistAgentFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Chat API: synchronous and streamed orchestration, history reset, health
 */
@Slf4j
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

  public static final String USER_HEADER = "X-User-Id";

  private final ChatService chatService;

  private final OrchestrationStreamBridge streamBridge;

  private final AgentProperties agentProperties;

  /**
   * Run the orchestrator and reply once it has finished
   */
  @PostMapping("/message")
  public Mono<ResponseEntity<ChatResponse>> message(@RequestHeader(USER_HEADER) long userId,
    @Valid @RequestBody ChatRequest request) {
    return Mono.fromCallable(() -> {
      log.info("Chat message from user {}: {}", userId,
        StringUtils.truncate(request.getMessage(), 100));
      ChatReply reply = chatService.chat(userId, request.getMessage());
      return ResponseEntity.ok(ChatResponse.from(reply));
    }).subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * Run the orchestrator and stream its progress as server-sent events
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public ResponseEntity<Flux<ServerSentEvent<AgentStreamEvent>>> stream(
    @RequestHeader(USER_HEADER) long userId, @Valid @RequestBody ChatRequest request) {
    log.info("Streamed chat message from user {}: {}", userId,
      StringUtils.truncate(request.getMessage(), 100));

    Flux<ServerSentEvent<AgentStreamEvent>> events = streamBridge
      .stream(userId, request.getMessage())
      .map(event -> ServerSentEvent.builder(event).build());

    return ResponseEntity.ok()
      .cacheControl(CacheControl.noCache())
      .header("X-Accel-Buffering", "no")
      .contentType(MediaType.TEXT_EVENT_STREAM)
      .body(events);
  }

  @PostMapping("/clear")
  public ResponseEntity<Map<String, String>> clear(@RequestHeader(USER_HEADER) long userId) {
    chatService.clear(userId);
    return ResponseEntity.ok(Map.of("message", "Conversation history cleared successfully"));
  }

  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "healthy");
    health.put("service", "Multi-Agent Financial Chat");
    health.put("agents", List.of(
      agentProperties.getOrchestratorName(),
      SpecialistAgentFactory.ANALYTICS_AGENT_NAME,
      SpecialistAgentFactory.ADVISOR_AGENT_NAME));
    health.put("features", List.of(
      "Conversation Memory",
      "User Context Awareness",
      "Streaming Agent Activity"));
    return ResponseEntity.ok(health);
  }

  @Data
  public static class ChatRequest {

    @NotBlank
    private String message;
  }

  @Data
  public static class ChatResponse {

    private String response;

    @JsonProperty("agents_consulted")
    private List<String> agentsConsulted;

    private int iterations;

    @JsonProperty("agent_timeline")
    private List<DelegationRecord> agentTimeline;

    public static ChatResponse from(ChatReply reply) {
      ChatResponse response = new ChatResponse();
      response.setResponse(reply.response());
      response.setAgentsConsulted(reply.agentsConsulted());
      response.setIterations(reply.iterations());
      response.setAgentTimeline(reply.agentTimeline());
      return response;
    }
  }
}
