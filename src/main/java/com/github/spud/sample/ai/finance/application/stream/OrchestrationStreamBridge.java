package com.github.spud.sample.ai.finance.application.stream;

import com.github.spud.sample.ai.finance.application.ChatService;
import com.github.spud.sample.ai.finance.application.config.AgentProperties;
import com.github.spud.sample.ai.finance.domain.agent.AgentCancelledException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Turns one blocking orchestration run into an ordered stream of frames. The run executes on a
 * bounded-elastic worker and pushes frames into a buffered sink as delegations complete; the sink
 * completes right after the terminal frame.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrchestrationStreamBridge {

  private final ChatService chatService;

  private final AgentProperties agentProperties;

  public Flux<AgentStreamEvent> stream(long userId, String message) {
    return Flux.create(sink -> {
      AtomicBoolean cancelled = new AtomicBoolean(false);
      sink.onCancel(() -> {
        log.info("Stream for user {} cancelled by the caller", userId);
        cancelled.set(true);
      });

      sink.next(AgentStreamEvent.start(agentProperties.getOrchestratorName()));

      Mono.fromCallable(() -> chatService.runOrchestration(userId, message,
          (agent, data) -> sink.next(AgentStreamEvent.activity(agent, data)),
          cancelled::get))
        .subscribeOn(Schedulers.boundedElastic())
        .subscribe(
          result -> {
            sink.next(AgentStreamEvent.response(result));
            sink.next(AgentStreamEvent.done());
            sink.complete();
          },
          error -> {
            if (error instanceof AgentCancelledException) {
              log.info("Orchestration for user {} stopped: {}", userId, error.getMessage());
            } else {
              log.error("Streaming orchestration failed for user {}: {}", userId,
                error.getMessage(), error);
              sink.next(AgentStreamEvent.error(error.getMessage()));
            }
            sink.complete();
          });
    }, FluxSink.OverflowStrategy.BUFFER);
  }
}
