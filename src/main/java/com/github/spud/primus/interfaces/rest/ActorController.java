package com.github.spud.primus.interfaces.rest;

import com.github.spud.primus.domain.actor.Actor;
import com.github.spud.primus.domain.actor.ActorDirectory;
import com.github.spud.primus.domain.capability.CapabilityGrant;
import com.github.spud.primus.domain.capability.InternetAccess;
import com.github.spud.primus.domain.capability.RagWriteScope;
import com.github.spud.primus.domain.guard.ActorLifecycleService;
import com.github.spud.primus.domain.guard.AgentCommunicationGuard;
import com.github.spud.primus.domain.guard.InteractionGuard;
import com.github.spud.primus.domain.guard.PermissionReport;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Collection;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Actor Api
 */
@Slf4j
@RestController
@RequestMapping("/actors")
@RequiredArgsConstructor
public class ActorController {

  private final ActorDirectory actorDirectory;

  private final ActorLifecycleService lifecycleService;

  private final AgentCommunicationGuard communicationGuard;

  private final InteractionGuard guard;

  @GetMapping
  public Mono<ResponseEntity<Collection<Actor>>> list() {
    return Mono.fromCallable(() -> ResponseEntity.ok(actorDirectory.list()));
  }

  @PostMapping("/agents")
  public Mono<ResponseEntity<Actor>> createAgent(@RequestBody CreateActorRequestDto request) {
    return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED)
        .body(lifecycleService.createAgent(request.getName())))
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 从父级派生子会话，人格为父级的只读引用
   */
  @PostMapping("/subchats")
  public Mono<ResponseEntity<Actor>> createSubChat(@RequestBody CreateActorRequestDto request) {
    return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED)
        .body(lifecycleService.createSubChat(request.getParentId(), request.getName())))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @DeleteMapping("/{actorId}")
  public Mono<ResponseEntity<List<String>>> close(@PathVariable String actorId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(lifecycleService.close(actorId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 运行时收窄权限，只能收窄不能放宽
   */
  @PostMapping("/{actorId}/narrow")
  public Mono<ResponseEntity<CapabilityGrant>> narrow(
    @PathVariable String actorId,
    @RequestBody NarrowRequestDto request
  ) {
    return Mono.fromCallable(() -> ResponseEntity.ok(
        lifecycleService.narrow(actorId, request.toGrant())))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{actorId}/permissions")
  public Mono<ResponseEntity<PermissionReport>> permissions(@PathVariable String actorId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(guard.report(actorId)));
  }

  @PostMapping("/pairs")
  public Mono<ResponseEntity<PairResponse>> authorizePair(@Valid @RequestBody PairRequestDto request) {
    return Mono.fromCallable(() -> {
      actorDirectory.require(request.getFirst());
      actorDirectory.require(request.getSecond());
      communicationGuard.authorizePair(request.getFirst(), request.getSecond());
      return ResponseEntity.ok(new PairResponse(request.getFirst(), request.getSecond(), true));
    });
  }

  @DeleteMapping("/pairs")
  public Mono<ResponseEntity<PairResponse>> revokePair(@Valid @RequestBody PairRequestDto request) {
    return Mono.fromCallable(() -> {
      communicationGuard.revokePair(request.getFirst(), request.getSecond());
      return ResponseEntity.ok(new PairResponse(request.getFirst(), request.getSecond(), false));
    });
  }

  // ===== DTOs =====

  @Data
  public static class CreateActorRequestDto {

    private String name;
    private String parentId;
  }

  /**
   * Fields left out narrow nothing.
   */
  @Data
  public static class NarrowRequestDto {

    private InternetAccess internetAccess;
    private Boolean agentToAgent;
    private Boolean subchatCrossAccess;
    private Boolean personalityWrite;
    private RagWriteScope ragWriteScope;

    CapabilityGrant toGrant() {
      return CapabilityGrant.builder()
        .internetAccess(internetAccess != null ? internetAccess : InternetAccess.TEMPORARY_SESSION)
        .agentToAgent(agentToAgent == null || agentToAgent)
        .subchatCrossAccess(subchatCrossAccess == null || subchatCrossAccess)
        .personalityWrite(personalityWrite == null || personalityWrite)
        .ragWriteScope(ragWriteScope != null ? ragWriteScope : RagWriteScope.OWN_PARTITION_ONLY)
        .build();
    }
  }

  @Data
  public static class PairRequestDto {

    @NotBlank
    private String first;
    @NotBlank
    private String second;
  }

  @Data
  @AllArgsConstructor
  public static class PairResponse {

    private String first;
    private String second;
    private boolean authorized;
  }
}
