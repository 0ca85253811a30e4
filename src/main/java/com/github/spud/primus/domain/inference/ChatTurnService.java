package com.github.spud.primus.domain.inference;

import com.github.spud.primus.domain.actor.Actor;
import com.github.spud.primus.domain.actor.ActorDirectory;
import com.github.spud.primus.domain.actor.PersonalityRef;
import com.github.spud.primus.domain.guard.ActionOutcome;
import com.github.spud.primus.domain.guard.InteractionGuard;
import com.github.spud.primus.domain.policy.Action;
import com.github.spud.primus.domain.policy.ActionKind;
import com.github.spud.primus.domain.policy.Decision;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs one chat turn: authorizes it, assembles the readable context through the guard, calls the
 * inference backend and appends the exchange to the actor's own history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatTurnService {

  public static final String HISTORY_KEY = "history";

  private final InteractionGuard guard;

  private final ActorDirectory actorDirectory;

  private final InferenceBackend backend;

  public Mono<ChatTurnResult> chat(String actorId, String prompt, List<ContextRef> contextRefs) {
    return Mono.fromCallable(() -> prepare(actorId, prompt, contextRefs))
      .subscribeOn(Schedulers.boundedElastic())
      .flatMap(turn -> {
        if (!turn.decision.isAllowed()) {
          return Mono.just(turn.result(null));
        }
        return backend.complete(prompt, turn.context)
          .publishOn(Schedulers.boundedElastic())
          .map(completion -> {
            recordHistory(turn.actor, prompt, completion);
            return turn.result(completion);
          });
      });
  }

  private PreparedTurn prepare(String actorId, String prompt, List<ContextRef> contextRefs) {
    Decision decision = guard.authorize(Action.builder()
      .actorId(actorId)
      .kind(ActionKind.CHAT_TURN)
      .build());
    PreparedTurn turn = new PreparedTurn(decision);
    if (!decision.isAllowed()) {
      return turn;
    }
    turn.actor = actorDirectory.require(actorId);
    ContextBundle.ContextBundleBuilder bundle = ContextBundle.builder().actorId(actorId);

    PersonalityRef personality = turn.actor.getPersonality();
    ActionOutcome personalityRead = read(actorId, ContextRef.of(personality.getPartition(),
      personality.getKey()));
    if (personalityRead.isCompleted()) {
      bundle.personality(new String(personalityRead.getData(), StandardCharsets.UTF_8));
    }

    for (ContextRef ref : contextRefs == null ? List.<ContextRef>of() : contextRefs) {
      ActionOutcome outcome = read(actorId, ref);
      if (outcome.isCompleted()) {
        bundle.snippet(new ContextBundle.Snippet(ref.getPartition() + ":" + ref.getKey(),
          new String(outcome.getData(), StandardCharsets.UTF_8)));
        turn.included.add(ref);
      } else {
        turn.excluded.add(ref);
      }
    }
    turn.context = bundle.build();
    log.debug("Chat turn prepared: actorId={}, included={}, excluded={}", actorId,
      turn.included.size(), turn.excluded.size());
    return turn;
  }

  private ActionOutcome read(String actorId, ContextRef ref) {
    return guard.execute(Action.builder()
      .actorId(actorId)
      .kind(ActionKind.MEMORY_READ)
      .target(ref.getPartition())
      .key(ref.getKey())
      .build());
  }

  private void recordHistory(Actor actor, String prompt, String completion) {
    String exchange = "user: " + prompt + "\nassistant: " + completion + "\n";
    ActionOutcome outcome = guard.execute(Action.builder()
      .actorId(actor.getId())
      .kind(ActionKind.MEMORY_APPEND)
      .target(actor.ownPartition())
      .key(HISTORY_KEY)
      .payload(exchange.getBytes(StandardCharsets.UTF_8))
      .build());
    if (!outcome.isCompleted()) {
      log.debug("History not recorded: actorId={}, status={}", actor.getId(), outcome.getStatus());
    }
  }

  private static final class PreparedTurn {

    private final Decision decision;

    private final List<ContextRef> included = new ArrayList<>();

    private final List<ContextRef> excluded = new ArrayList<>();

    private Actor actor;

    private ContextBundle context;

    private PreparedTurn(Decision decision) {
      this.decision = decision;
    }

    private ChatTurnResult result(String completion) {
      return ChatTurnResult.builder()
        .decision(decision)
        .completion(completion)
        .included(List.copyOf(included))
        .excluded(List.copyOf(excluded))
        .build();
    }
  }
}
