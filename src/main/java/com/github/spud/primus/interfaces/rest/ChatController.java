package com.github.spud.primus.interfaces.rest;

import com.github.spud.primus.domain.inference.ChatTurnResult;
import com.github.spud.primus.domain.inference.ChatTurnService;
import com.github.spud.primus.domain.inference.ContextRef;
import com.github.spud.primus.domain.memory.PartitionClass;
import com.github.spud.primus.domain.memory.PartitionId;
import com.github.spud.primus.domain.policy.DecisionReason;
import com.github.spud.primus.domain.policy.DecisionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 对话 Api
 */
@Slf4j
@RestController
@RequestMapping("/chat")
@RequiredArgsConstructor
public class ChatController {

  private final ChatTurnService chatTurnService;

  @PostMapping("/{actorId}")
  public Mono<ResponseEntity<ChatResponse>> chat(
    @PathVariable String actorId,
    @Valid @RequestBody ChatRequestDto request
  ) {
    List<ContextRef> refs = request.getContext() == null ? List.of()
      : request.getContext().stream()
        .map(c -> ContextRef.of(PartitionId.of(c.getOwner(), c.getPartitionClass()), c.getKey()))
        .collect(Collectors.toList());
    return chatTurnService.chat(actorId, request.getPrompt(), refs)
      .map(result -> ResponseEntity.ok(ChatResponse.of(result)));
  }

  // ===== DTOs =====

  @Data
  public static class ChatRequestDto {

    @NotBlank
    private String prompt;
    @Valid
    private List<ContextRefDto> context;
  }

  @Data
  public static class ContextRefDto {

    @NotBlank
    private String owner;
    @NotNull
    private PartitionClass partitionClass;
    @NotBlank
    private String key;
  }

  @Data
  @Builder
  public static class ChatResponse {

    private DecisionType decision;
    private DecisionReason reason;
    private String completion;
    private int includedContext;
    private int excludedContext;

    static ChatResponse of(ChatTurnResult result) {
      return ChatResponse.builder()
        .decision(result.getDecision().getType())
        .reason(result.getDecision().getReason())
        .completion(result.getCompletion())
        .includedContext(result.getIncluded().size())
        .excludedContext(result.getExcluded().size())
        .build();
    }
  }
}
