package com.github.spud.primus.infrastructure.inference;

import com.github.spud.primus.domain.inference.ContextBundle;
import com.github.spud.primus.domain.inference.InferenceBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Inference backed by a Spring AI {@link ChatClient}.
 */
@Slf4j
@RequiredArgsConstructor
public class ChatClientInferenceBackend implements InferenceBackend {

  private final ChatClient chatClient;

  @Override
  public Mono<String> complete(String prompt, ContextBundle context) {
    return Mono.fromCallable(() -> {
        String system = context.render();
        ChatClient.ChatClientRequestSpec request = chatClient.prompt();
        if (!system.isEmpty()) {
          request = request.system(system);
        }
        String content = request.user(prompt).call().content();
        log.debug("Completion received: actorId={}, length={}", context.getActorId(),
          content != null ? content.length() : 0);
        return content != null ? content : "";
      })
      .subscribeOn(Schedulers.boundedElastic());
  }
}
