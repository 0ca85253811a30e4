package com.github.spud.primus.domain.guard;

import com.github.spud.primus.application.config.PolicyProperties;
import com.github.spud.primus.domain.memory.PartitionClass;
import com.github.spud.primus.domain.memory.PartitionId;
import com.github.spud.primus.domain.policy.Action;
import com.github.spud.primus.domain.policy.Decision;
import com.github.spud.primus.domain.policy.DecisionReason;
import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Agent-to-agent rules: which pairs the user authorized, which collaboration groups are open and
 * which private keys were shared inside them.
 * <p>
 * {@link #check} only reads. {@link #apply} re-checks and mutates atomically, so two agents racing
 * for the last free slot cannot both get in.
 */
@Slf4j
@Component
public class AgentCommunicationGuard {

  private final Set<Set<String>> authorizedPairs = new HashSet<>();

  private final Map<String, CollaborationGroup> groups = new HashMap<>();

  private final Map<String, String> groupOfMember = new HashMap<>();

  private final int maxActiveCollaborations;

  private final Clock clock;

  @Autowired
  public AgentCommunicationGuard(PolicyProperties properties) {
    this(properties.getMaxActiveCollaborations(), Clock.systemUTC());
  }

  public AgentCommunicationGuard(int maxActiveCollaborations, Clock clock) {
    this.maxActiveCollaborations = maxActiveCollaborations;
    this.clock = clock;
  }

  /**
   * User command: allows two agents to talk to each other.
   */
  public synchronized void authorizePair(String first, String second) {
    if (first.equals(second)) {
      throw new IllegalArgumentException("An agent cannot be paired with itself");
    }
    authorizedPairs.add(Set.of(first, second));
    log.info("Authorized agent pair: {} <-> {}", first, second);
  }

  /**
   * User command: withdraws a pair authorization. A group formed by the pair is dissolved.
   */
  public synchronized boolean revokePair(String first, String second) {
    boolean removed = authorizedPairs.remove(Set.of(first, second));
    String group = groupOfMember.get(first);
    if (group != null && group.equals(groupOfMember.get(second))) {
      dissolve(group);
    }
    if (removed) {
      log.info("Revoked agent pair: {} <-> {}", first, second);
    }
    return removed;
  }

  public synchronized boolean isPairAuthorized(String first, String second) {
    return authorizedPairs.contains(Set.of(first, second));
  }

  /**
   * Evaluates a communication action without changing anything.
   */
  public synchronized Decision check(Action action) {
    String actorId = action.getActorId();
    String partnerId = action.getCounterpartId();
    switch (action.getKind()) {
      case LEAVE_COLLABORATION:
        return groupOfMember.containsKey(actorId) ? Decision.allow()
          : Decision.deny(DecisionReason.NOT_IN_COLLABORATION, actorId + " is not collaborating");
      case SHARE_MEMORY:
        return checkShare(actorId, partnerId);
      case AGENT_MESSAGE:
      case JOIN_COLLABORATION:
        return checkJoin(actorId, partnerId);
      default:
        return Decision.deny(DecisionReason.INVALID_ACTION,
          action.getKind() + " is not an agent communication action");
    }
  }

  /**
   * Re-checks an allowed action and applies its effect. A failed re-check leaves state untouched
   * and returns the denial.
   */
  public synchronized Decision apply(Action action) {
    Decision decision = check(action);
    if (!decision.isAllowed()) {
      return decision;
    }
    String actorId = action.getActorId();
    switch (action.getKind()) {
      case LEAVE_COLLABORATION:
        dissolve(groupOfMember.get(actorId));
        break;
      case SHARE_MEMORY:
        groups.get(groupOfMember.get(actorId)).share(actorId, action.getSharedKeys());
        log.info("Shared memory keys: actorId={}, count={}", actorId, action.getSharedKeys().size());
        break;
      default:
        if (groupOfMember.get(actorId) == null) {
          open(actorId, action.getCounterpartId());
        }
        break;
    }
    return decision;
  }

  /**
   * Whether {@code readerId} may read {@code key} from another agent's private partition.
   */
  public synchronized boolean isShared(PartitionId partition, String key, String readerId) {
    if (partition.getPartitionClass() != PartitionClass.AGENT_PRIVATE) {
      return false;
    }
    String ownerId = partition.getOwnerId();
    String group = groupOfMember.get(ownerId);
    if (group == null || !group.equals(groupOfMember.get(readerId))) {
      return false;
    }
    return groups.get(group).isShared(ownerId, key);
  }

  public synchronized List<CollaborationGroup> activeGroups() {
    return List.copyOf(groups.values());
  }

  /**
   * Removes every trace of an actor: its group and every pair it belongs to.
   */
  public synchronized void dissolveFor(String actorId) {
    String group = groupOfMember.get(actorId);
    if (group != null) {
      dissolve(group);
    }
    authorizedPairs.removeIf(pair -> pair.contains(actorId));
  }

  private Decision checkJoin(String actorId, String partnerId) {
    if (partnerId == null || !authorizedPairs.contains(Set.of(actorId, partnerId))) {
      return Decision.deny(DecisionReason.PARTNER_NOT_AUTHORIZED,
        "Pair " + actorId + " <-> " + partnerId + " has not been authorized");
    }
    String actorGroup = groupOfMember.get(actorId);
    String partnerGroup = groupOfMember.get(partnerId);
    if (actorGroup != null && actorGroup.equals(partnerGroup)) {
      return Decision.allow();
    }
    if (actorGroup != null || partnerGroup != null) {
      return Decision.deny(DecisionReason.COLLABORATION_FULL,
        "Collaboration groups hold at most " + CollaborationGroup.MAX_MEMBERS
          + " agents and an agent joins one group at a time");
    }
    if (groups.size() >= maxActiveCollaborations) {
      return Decision.deny(DecisionReason.COLLABORATION_LIMIT_REACHED,
        "At most " + maxActiveCollaborations + " collaborations may be active");
    }
    return Decision.allow();
  }

  private Decision checkShare(String actorId, String partnerId) {
    String group = groupOfMember.get(actorId);
    if (group == null || partnerId == null || !group.equals(groupOfMember.get(partnerId))) {
      return Decision.deny(DecisionReason.NOT_IN_COLLABORATION,
        "Memory can only be shared inside an open collaboration");
    }
    return Decision.allow();
  }

  private void open(String first, String second) {
    CollaborationGroup group = new CollaborationGroup(UUID.randomUUID().toString(), first, second,
      clock.instant());
    groups.put(group.getId(), group);
    groupOfMember.put(first, group.getId());
    groupOfMember.put(second, group.getId());
    log.info("Collaboration opened: groupId={}, members={}", group.getId(), group.getMembers());
  }

  private void dissolve(String groupId) {
    CollaborationGroup group = groups.remove(groupId);
    if (group != null) {
      group.getMembers().forEach(groupOfMember::remove);
      log.info("Collaboration dissolved: groupId={}", groupId);
    }
  }
}
