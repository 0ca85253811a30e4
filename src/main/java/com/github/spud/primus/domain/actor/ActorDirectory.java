package com.github.spud.primus.domain.actor;

import com.github.spud.primus.application.config.PolicyProperties;
import com.github.spud.primus.domain.capability.CapabilityGrant;
import com.github.spud.primus.domain.memory.PartitionId;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Registry of live actors and their runtime-narrowed grants. Primus and the sandbox actor exist for
 * the whole life of the process; agents and subchats come and go.
 */
@Slf4j
@Service
public class ActorDirectory {

  private final Map<String, Actor> actors = new ConcurrentHashMap<>();

  private final Map<String, CapabilityGrant> runtimeGrants = new ConcurrentHashMap<>();

  private final Clock clock;

  private final String primusId;

  private final String sandboxId;

  @Autowired
  public ActorDirectory(PolicyProperties properties) {
    this(properties, Clock.systemUTC());
  }

  public ActorDirectory(PolicyProperties properties, Clock clock) {
    this.clock = clock;
    this.primusId = properties.getPrimusId();
    this.sandboxId = properties.getSandboxId();

    Actor primus = Actor.builder()
      .id(primusId)
      .kind(ActorKind.PRIMUS)
      .name("Primus")
      .personality(PersonalityRef.owned(
        PartitionId.of(primusId, ActorKind.PRIMUS.ownPartitionClass())))
      .createdAt(clock.instant())
      .build();
    actors.put(primus.getId(), primus);

    // 沙箱编辑的是 Primus 的人格，自己不持有人格文档
    Actor sandbox = Actor.builder()
      .id(sandboxId)
      .kind(ActorKind.SANDBOX)
      .name("Captain's Log")
      .personality(primus.getPersonality().readOnlyAlias())
      .createdAt(clock.instant())
      .build();
    actors.put(sandbox.getId(), sandbox);
  }

  public Actor primus() {
    return actors.get(primusId);
  }

  public Actor sandbox() {
    return actors.get(sandboxId);
  }

  public Optional<Actor> find(String actorId) {
    return actorId == null ? Optional.empty() : Optional.ofNullable(actors.get(actorId));
  }

  public Actor require(String actorId) {
    return find(actorId).orElseThrow(() -> new UnknownActorException(actorId));
  }

  public Collection<Actor> list() {
    return List.copyOf(actors.values());
  }

  /**
   * Registers a specialized agent created by Primus. The agent owns its personality document,
   * stored in its private partition.
   */
  public Actor createAgent(String name) {
    String id = "agent-" + UUID.randomUUID();
    Actor agent = Actor.builder()
      .id(id)
      .kind(ActorKind.AGENT)
      .name(StringUtils.hasText(name) ? name : id)
      .parentId(primusId)
      .personality(PersonalityRef.owned(PartitionId.of(id, ActorKind.AGENT.ownPartitionClass())))
      .createdAt(clock.instant())
      .build();
    actors.put(id, agent);
    log.info("Created agent: actorId={}, name={}", id, agent.getName());
    return agent;
  }

  /**
   * Registers a subchat derived from {@code parentId}. Its personality is a read-only alias of the
   * parent's, whatever the parent's own reference is.
   */
  public Actor createSubChat(String parentId, String name) {
    Actor parent = require(parentId);
    if (parent.is(ActorKind.SANDBOX)) {
      throw new IllegalArgumentException("Subchats cannot be derived from the sandbox");
    }
    String id = "subchat-" + UUID.randomUUID();
    Actor subChat = Actor.builder()
      .id(id)
      .kind(ActorKind.SUBCHAT)
      .name(StringUtils.hasText(name) ? name : id)
      .parentId(parent.getId())
      .personality(parent.getPersonality().readOnlyAlias())
      .createdAt(clock.instant())
      .build();
    actors.put(id, subChat);
    log.info("Created subchat: actorId={}, parentId={}", id, parent.getId());
    return subChat;
  }

  /**
   * Removes an actor and every subchat derived from it, directly or transitively.
   *
   * @return ids of all removed actors, the requested one first
   */
  public List<String> remove(String actorId) {
    Actor actor = require(actorId);
    if (actor.is(ActorKind.PRIMUS) || actor.is(ActorKind.SANDBOX)) {
      throw new IllegalArgumentException("Actor " + actorId + " cannot be removed");
    }
    List<String> removed = new ArrayList<>();
    Deque<String> queue = new ArrayDeque<>();
    queue.add(actorId);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      if (actors.remove(current) != null) {
        runtimeGrants.remove(current);
        removed.add(current);
        actors.values().stream()
          .filter(a -> current.equals(a.getParentId()))
          .forEach(a -> queue.add(a.getId()));
      }
    }
    log.info("Removed actors: {}", removed);
    return removed;
  }

  /**
   * Narrows the runtime grant of an actor. The stored grant is always the intersection of every
   * narrowing applied so far, so repeated calls can only take capabilities away.
   */
  public CapabilityGrant narrow(String actorId, CapabilityGrant requested) {
    require(actorId);
    CapabilityGrant narrowed = runtimeGrants.merge(actorId, requested, CapabilityGrant::intersect);
    log.info("Narrowed runtime grant: actorId={}, grant={}", actorId, narrowed);
    return narrowed;
  }

  public Optional<CapabilityGrant> runtimeGrant(String actorId) {
    return Optional.ofNullable(runtimeGrants.get(actorId));
  }
}
