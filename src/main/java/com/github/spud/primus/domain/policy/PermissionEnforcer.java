package com.github.spud.primus.domain.policy;

import com.github.spud.primus.domain.actor.Actor;
import com.github.spud.primus.domain.actor.ActorDirectory;
import com.github.spud.primus.domain.actor.ActorKind;
import com.github.spud.primus.domain.actor.PersonalityRef;
import com.github.spud.primus.domain.capability.CapabilityGrant;
import com.github.spud.primus.domain.capability.CapabilityRegistry;
import com.github.spud.primus.domain.capability.InternetAccess;
import com.github.spud.primus.domain.capability.RagWriteScope;
import com.github.spud.primus.domain.guard.AgentCommunicationGuard;
import com.github.spud.primus.domain.memory.PartitionClass;
import com.github.spud.primus.domain.memory.PartitionId;
import com.github.spud.primus.domain.state.Mode;
import com.github.spud.primus.domain.state.ModeSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Pure decision function over (actor, action, mode). Never mutates state and never throws for a
 * denial; the interaction guard applies side effects of allowed actions.
 * <p>
 * All deny rules run before any rule that could ask for approval, so an action that would be denied
 * anyway never reaches the user as a confirmation prompt.
 */
@Component
@RequiredArgsConstructor
public class PermissionEnforcer {

  private final CapabilityRegistry capabilityRegistry;

  private final ActorDirectory actorDirectory;

  private final ReadGrantRegistry readGrants;

  private final AgentCommunicationGuard communicationGuard;

  /**
   * Template of the actor's kind, narrowed by its runtime grant. Agents and subchats are further
   * bounded by what Primus holds right now, except for the RAG write scope, which always stays
   * the holder's own. Sandbox mode additionally takes internet access away from everyone.
   */
  public CapabilityGrant effectiveGrant(Actor actor, Mode mode) {
    CapabilityGrant grant = ownGrant(actor);
    if (actor.is(ActorKind.AGENT) || actor.is(ActorKind.SUBCHAT)) {
      CapabilityGrant primus = ownGrant(actorDirectory.primus());
      grant = grant.intersect(primus.toBuilder().ragWriteScope(grant.getRagWriteScope()).build());
    }
    return mode == Mode.SANDBOX ? grant.offline() : grant;
  }

  private CapabilityGrant ownGrant(Actor actor) {
    return capabilityRegistry.capabilitiesFor(actor.getKind())
      .intersect(actorDirectory.runtimeGrant(actor.getId()).orElse(null));
  }

  /**
   * @param actor the requesting actor, or {@code null} when the action names an unknown actor
   */
  public Decision evaluate(Actor actor, Action action, ModeSnapshot snapshot) {
    if (actor == null) {
      return Decision.deny(DecisionReason.UNKNOWN_ACTOR,
        "Actor " + action.getActorId() + " is not registered");
    }
    ActionKind kind = action.getKind();
    if (kind.targetsPartition() && action.getTarget() == null) {
      return Decision.deny(DecisionReason.INVALID_ACTION, kind + " requires a target partition");
    }
    boolean confirmedReplay = action.isConfirmed() && kind.isConfirmableWrite();
    if (actor.is(ActorKind.SANDBOX) && !snapshot.isSandbox() && !confirmedReplay) {
      return Decision.deny(DecisionReason.SANDBOX_INACTIVE,
        "The sandbox actor acts only in sandbox mode");
    }
    PartitionId target = action.getTarget();
    if (target != null && target.isSandboxPrivate()
      && !(snapshot.isSandbox() && actor.is(ActorKind.SANDBOX))) {
      return Decision.deny(DecisionReason.SANDBOX_PARTITION_SEALED,
        "Sandbox-private memory is reachable only from inside the sandbox");
    }

    CapabilityGrant grant = effectiveGrant(actor, snapshot.getMode());
    return switch (kind) {
      case CHAT_TURN -> Decision.allow();
      case MEMORY_READ -> checkRead(actor, action, grant);
      case MEMORY_WRITE, MEMORY_APPEND -> checkWrite(actor, action, grant);
      case PERSONALITY_WRITE, SETTING_WRITE -> checkConfirmableWrite(actor, action, grant, snapshot);
      case GRANT_READ, REVOKE_READ -> checkReadGrant(actor, action);
      case AGENT_MESSAGE, JOIN_COLLABORATION, SHARE_MEMORY, LEAVE_COLLABORATION ->
        checkAgentCommunication(actor, action, grant, snapshot);
      case INTERNET_CALL -> checkInternet(actor, action, grant, snapshot);
    };
  }

  private Decision checkRead(Actor actor, Action action, CapabilityGrant grant) {
    PartitionId target = action.getTarget();
    String key = action.effectiveKey();
    if (target.getOwnerId().equals(actor.getId())) {
      return Decision.allow();
    }
    // 子会话与沙箱只读地引用父级人格
    if (PersonalityRef.PERSONALITY_KEY.equals(key)
      && target.equals(actor.getPersonality().getPartition())) {
      return Decision.allow();
    }
    switch (target.getPartitionClass()) {
      case GLOBAL:
        return Decision.allow();
      case SUBCHAT:
        if (!grant.isSubchatCrossAccess()) {
          return Decision.deny(DecisionReason.CAPABILITY_MISSING,
            actor.getId() + " has no subchat cross-access");
        }
        return readGrants.isGranted(target, actor.getId()) ? Decision.allow()
          : Decision.deny(DecisionReason.CROSS_READ_NOT_GRANTED,
            "No read grant on " + target + " for " + actor.getId());
      case AGENT_PRIVATE:
        if (actor.is(ActorKind.AGENT)) {
          return communicationGuard.isShared(target, key, actor.getId()) ? Decision.allow()
            : Decision.deny(DecisionReason.PRIVATE_PARTITION_NOT_SHARED,
              "Key '" + key + "' of " + target + " was not shared with " + actor.getId());
        }
        return readGrants.isGranted(target, actor.getId()) ? Decision.allow()
          : Decision.deny(DecisionReason.CROSS_READ_NOT_GRANTED,
            "No read grant on " + target + " for " + actor.getId());
      default:
        return Decision.deny(DecisionReason.SANDBOX_PARTITION_SEALED,
          "Sandbox-private memory belongs to the sandbox actor");
    }
  }

  private Decision checkWrite(Actor actor, Action action, CapabilityGrant grant) {
    if (grant.getRagWriteScope() == RagWriteScope.NONE) {
      return Decision.deny(DecisionReason.RAG_WRITE_FORBIDDEN,
        actor.getId() + " may not write memory");
    }
    if (!action.getTarget().equals(actor.ownPartition())) {
      return Decision.deny(DecisionReason.NOT_PARTITION_OWNER,
        "Writes are limited to the actor's own partition " + actor.ownPartition());
    }
    String key = action.effectiveKey();
    if (PersonalityRef.PERSONALITY_KEY.equals(key) || key.startsWith(Action.SETTINGS_PREFIX)) {
      return Decision.deny(DecisionReason.PERSONALITY_WRITE_FORBIDDEN,
        "Key '" + key + "' changes only through a confirmed write");
    }
    return Decision.allow();
  }

  private Decision checkConfirmableWrite(Actor actor, Action action, CapabilityGrant grant,
    ModeSnapshot snapshot) {
    if (!grant.isPersonalityWrite()) {
      return Decision.deny(DecisionReason.PERSONALITY_WRITE_FORBIDDEN,
        actor.getKind() + " actors cannot change personality or settings");
    }
    PartitionId target = action.getTarget();
    boolean targetAllowed = switch (actor.getKind()) {
      case PRIMUS -> target.equals(actor.ownPartition())
        || (action.getKind() == ActionKind.PERSONALITY_WRITE
        && target.getPartitionClass() == PartitionClass.AGENT_PRIVATE
        && actorDirectory.find(target.getOwnerId()).isPresent());
      case SANDBOX -> target.equals(actorDirectory.primus().ownPartition());
      default -> false;
    };
    if (!targetAllowed) {
      return Decision.deny(DecisionReason.NOT_PARTITION_OWNER,
        actor.getId() + " cannot edit " + action.effectiveKey() + " in " + target);
    }
    if (action.isConfirmed()) {
      return Decision.allow();
    }
    if (snapshot.hasPending(actor.getId(), action.getKind())) {
      return Decision.deny(DecisionReason.APPROVAL_PENDING,
        "An earlier " + action.getKind() + " of " + actor.getId() + " awaits approval");
    }
    if (snapshot.isSandbox()) {
      return Decision.requireApproval(DecisionReason.HELD_UNTIL_SANDBOX_EXIT,
        "Held until the user confirms it when leaving the sandbox");
    }
    return Decision.requireApproval(DecisionReason.CONFIRMATION_REQUIRED,
      action.getKind() + " needs user confirmation");
  }

  private Decision checkReadGrant(Actor actor, Action action) {
    PartitionId target = action.getTarget();
    if (target.isSandboxPrivate()) {
      return Decision.deny(DecisionReason.SANDBOX_PARTITION_SEALED,
        "Sandbox-private memory cannot be shared");
    }
    if (!target.getOwnerId().equals(actor.getId())) {
      return Decision.deny(DecisionReason.NOT_PARTITION_OWNER,
        "Only the owner of " + target + " can manage its read grants");
    }
    Actor grantee = actorDirectory.find(action.getCounterpartId()).orElse(null);
    if (grantee == null) {
      return Decision.deny(DecisionReason.UNKNOWN_ACTOR,
        "Grantee " + action.getCounterpartId() + " is not registered");
    }
    if (grantee.getId().equals(actor.getId())) {
      return Decision.deny(DecisionReason.INVALID_ACTION, "An owner always reads its own partition");
    }
    if (action.getKind() == ActionKind.GRANT_READ
      && target.getPartitionClass() == PartitionClass.AGENT_PRIVATE
      && !grantee.is(ActorKind.PRIMUS)) {
      return Decision.deny(DecisionReason.PRIVATE_PARTITION_NOT_SHARED,
        "Agents share private memory with each other key by key inside a collaboration");
    }
    return Decision.allow();
  }

  private Decision checkAgentCommunication(Actor actor, Action action, CapabilityGrant grant,
    ModeSnapshot snapshot) {
    if (snapshot.isSandbox()) {
      return Decision.deny(DecisionReason.SANDBOX_OFFLINE,
        "Agent communication is suspended in sandbox mode");
    }
    if (!actor.is(ActorKind.AGENT) || !grant.isAgentToAgent()) {
      return Decision.deny(DecisionReason.AGENT_COMMUNICATION_DISABLED,
        actor.getId() + " cannot communicate with agents");
    }
    if (action.getKind() != ActionKind.LEAVE_COLLABORATION) {
      Actor partner = actorDirectory.find(action.getCounterpartId()).orElse(null);
      if (partner == null) {
        return Decision.deny(DecisionReason.UNKNOWN_ACTOR,
          "Partner " + action.getCounterpartId() + " is not registered");
      }
      if (!partner.is(ActorKind.AGENT)
        || !effectiveGrant(partner, snapshot.getMode()).isAgentToAgent()) {
        return Decision.deny(DecisionReason.AGENT_COMMUNICATION_DISABLED,
          partner.getId() + " cannot communicate with agents");
      }
    }
    if (action.getKind() == ActionKind.SHARE_MEMORY) {
      if (!action.getTarget().equals(actor.ownPartition())) {
        return Decision.deny(DecisionReason.NOT_PARTITION_OWNER,
          "Only keys of the actor's own private partition can be shared");
      }
      if (action.getSharedKeys() == null || action.getSharedKeys().isEmpty()) {
        return Decision.deny(DecisionReason.INVALID_ACTION, "No keys to share");
      }
      if (action.getSharedKeys().contains(PersonalityRef.PERSONALITY_KEY)) {
        return Decision.deny(DecisionReason.PRIVATE_PARTITION_NOT_SHARED,
          "Personality documents are never shared");
      }
    }
    return communicationGuard.check(action);
  }

  private Decision checkInternet(Actor actor, Action action, CapabilityGrant grant,
    ModeSnapshot snapshot) {
    InternetAccess access = grant.getInternetAccess();
    if (access == InternetAccess.OFF) {
      return snapshot.isSandbox()
        ? Decision.deny(DecisionReason.SANDBOX_OFFLINE, "The sandbox is offline")
        : Decision.deny(DecisionReason.INTERNET_DISABLED, actor.getId() + " has no internet access");
    }
    if (action.isConfirmed()) {
      return Decision.allow();
    }
    if (access == InternetAccess.TEMPORARY_SESSION
      && snapshot.isSessionConfirmed(actor.getId(), ActionKind.INTERNET_CALL)) {
      return Decision.allow();
    }
    if (snapshot.hasPending(actor.getId(), ActionKind.INTERNET_CALL)) {
      return Decision.deny(DecisionReason.APPROVAL_PENDING,
        "An earlier internet call of " + actor.getId() + " awaits approval");
    }
    return Decision.requireApproval(DecisionReason.CONFIRMATION_REQUIRED,
      access == InternetAccess.PER_CALL ? "Every internet call needs confirmation"
        : "Internet access needs confirmation once per session");
  }
}
