package com.github.spud.primus.domain.guard;

import com.github.spud.primus.application.config.PolicyProperties;
import com.github.spud.primus.domain.actor.Actor;
import com.github.spud.primus.domain.actor.ActorDirectory;
import com.github.spud.primus.domain.audit.AuditLog;
import com.github.spud.primus.domain.capability.CapabilityGrant;
import com.github.spud.primus.domain.capability.InternetAccess;
import com.github.spud.primus.domain.memory.AccessOperation;
import com.github.spud.primus.domain.memory.AccessToken;
import com.github.spud.primus.domain.memory.MemoryPartitionStore;
import com.github.spud.primus.domain.memory.PartitionNotFoundException;
import com.github.spud.primus.domain.memory.TokenAuthority;
import com.github.spud.primus.domain.memory.TokenInvalidException;
import com.github.spud.primus.domain.policy.Action;
import com.github.spud.primus.domain.policy.ActionKind;
import com.github.spud.primus.domain.policy.Decision;
import com.github.spud.primus.domain.policy.DecisionReason;
import com.github.spud.primus.domain.policy.PermissionEnforcer;
import com.github.spud.primus.domain.policy.ReadGrantRegistry;
import com.github.spud.primus.domain.state.Mode;
import com.github.spud.primus.domain.state.ModeController;
import com.github.spud.primus.domain.state.ModeSnapshot;
import com.github.spud.primus.domain.state.PendingApproval;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single entry point for every action. Evaluates under the mode read lock, applies the effects of
 * allowed actions and runs their store operations under that same lock, suspends actions that need
 * confirmation and writes the audit trail.
 * <p>
 * This is the only holder of the store's token authority, so no store operation can happen without
 * a decision made here.
 */
@Slf4j
@Service
public class InteractionGuard {

  private final ActorDirectory actorDirectory;

  private final PermissionEnforcer enforcer;

  private final ModeController modeController;

  private final AgentCommunicationGuard communicationGuard;

  private final ReadGrantRegistry readGrants;

  private final MemoryPartitionStore store;

  private final AuditLog auditLog;

  private final TokenAuthority tokenAuthority;

  private final int retryLimit;

  public InteractionGuard(ActorDirectory actorDirectory, PermissionEnforcer enforcer,
    ModeController modeController, AgentCommunicationGuard communicationGuard,
    ReadGrantRegistry readGrants, MemoryPartitionStore store, AuditLog auditLog,
    PolicyProperties properties) {
    this.actorDirectory = actorDirectory;
    this.enforcer = enforcer;
    this.modeController = modeController;
    this.communicationGuard = communicationGuard;
    this.readGrants = readGrants;
    this.store = store;
    this.auditLog = auditLog;
    this.tokenAuthority = store.claimTokenAuthority();
    this.retryLimit = Math.max(0, properties.getDecisionRetryLimit());
  }

  /**
   * Decides an action without applying it: no grant, collaboration or session changes and no
   * store access. An action that needs confirmation is still suspended and the decision audited.
   * A caller-set confirmation flag is ignored; confirmation only comes from
   * {@link #resolveApproval}.
   */
  public Decision authorize(Action action) {
    return decide(action.unconfirmed(), false).getDecision();
  }

  /**
   * Decides an action and, when allowed, applies it and performs its store operation.
   */
  public ActionOutcome execute(Action action) {
    return decide(action.unconfirmed(), true);
  }

  /**
   * Approves or rejects a pending action. An approved action is replayed as confirmed and
   * evaluated again before any other mode transition can happen.
   */
  public ActionOutcome resolveApproval(String approvalId, boolean approve) {
    return modeController.resolve(approvalId, approval -> {
      Action action = approval.getAction();
      if (!approve) {
        Decision rejected = Decision.deny(DecisionReason.APPROVAL_REJECTED,
          "Rejected by the user").withApprovalId(approvalId);
        auditLog.record(action.getActorId(), action.getKind(), rejected);
        log.info("Approval rejected: approvalId={}, actorId={}, kind={}", approvalId,
          action.getActorId(), action.getKind());
        return ActionOutcome.notExecuted(rejected);
      }
      log.info("Approval granted: approvalId={}, actorId={}, kind={}", approvalId,
        action.getActorId(), action.getKind());
      return decide(action.confirmedReplay(), true);
    });
  }

  public void enterSandbox() {
    modeController.enterSandbox();
  }

  public List<PendingApproval> exitSandbox() {
    return modeController.exitSandbox();
  }

  /**
   * Capabilities an actor holds right now, for display.
   */
  public PermissionReport report(String actorId) {
    Actor actor = actorDirectory.require(actorId);
    return modeController.withReadLock(snapshot -> PermissionReport.builder()
      .actorId(actor.getId())
      .kind(actor.getKind())
      .mode(snapshot.getMode())
      .runtimeGrant(actorDirectory.runtimeGrant(actorId).orElse(null))
      .effectiveGrant(enforcer.effectiveGrant(actor, snapshot.getMode()))
      .collaboration(communicationGuard.activeGroups().stream()
        .filter(g -> g.contains(actorId))
        .findFirst()
        .map(CollaborationGroup::getId)
        .orElse(null))
      .pendingApprovals((int) modeController.pendingApprovals().stream()
        .filter(p -> p.getActorId().equals(actorId))
        .count())
      .build());
  }

  private ActionOutcome decide(Action action, boolean execute) {
    for (int attempt = 0; attempt <= retryLimit; attempt++) {
      Evaluation evaluation = modeController.withReadLock(
        snapshot -> evaluate(action, snapshot, execute));
      Decision decision = evaluation.outcome.getDecision();
      if (!decision.requiresApproval()) {
        return evaluation.outcome;
      }
      Optional<PendingApproval> approval = modeController.suspend(action, decision.getReason(),
        evaluation.epoch);
      if (approval.isPresent()) {
        Decision suspended = decision.withApprovalId(approval.get().getId());
        auditLog.append(action.getActorId(), action.getKind(), suspended, evaluation.mode);
        return ActionOutcome.notExecuted(suspended);
      }
      log.debug("Mode changed during evaluation, retrying: requestId={}, attempt={}",
        action.getRequestId(), attempt + 1);
    }
    Decision contention = Decision.deny(DecisionReason.MODE_CONTENTION,
      "Mode kept changing while the action was evaluated");
    auditLog.record(action.getActorId(), action.getKind(), contention);
    return ActionOutcome.notExecuted(contention);
  }

  /**
   * Runs under the mode read lock. When {@code execute} is set, an allowed action is applied and
   * its store operation performed before the lock is released.
   */
  private Evaluation evaluate(Action action, ModeSnapshot snapshot, boolean execute) {
    Actor actor = actorDirectory.find(action.getActorId()).orElse(null);
    Decision decision = enforcer.evaluate(actor, action, snapshot);
    if (decision.isAllowed() && execute) {
      decision = applyEffects(actor, action, snapshot, decision);
    }
    if (!snapshot.isAuditSuppressed()) {
      log.debug("Decision: requestId={}, actorId={}, kind={}, type={}, reason={}",
        action.getRequestId(), action.getActorId(), action.getKind(), decision.getType(),
        decision.getReason());
    }
    if (!decision.requiresApproval()) {
      auditLog.append(action.getActorId(), action.getKind(), decision, snapshot.getMode());
    }
    ActionOutcome outcome;
    if (!decision.isAllowed()) {
      outcome = ActionOutcome.notExecuted(decision);
    } else if (execute) {
      outcome = perform(action, decision, snapshot);
    } else {
      outcome = ActionOutcome.completed(decision, null);
    }
    return new Evaluation(outcome, snapshot.getMode(), snapshot.getEpoch());
  }

  private ActionOutcome perform(Action action, Decision decision, ModeSnapshot snapshot) {
    AccessOperation operation = action.getKind().storeOperation();
    if (operation == null) {
      return ActionOutcome.completed(decision, null);
    }
    AccessToken token = decision.getToken();
    try {
      byte[] data = null;
      switch (operation) {
        case READ:
          data = store.read(action.getTarget(), token);
          break;
        case WRITE:
          store.write(action.getTarget(), token, payloadOf(action));
          break;
        case APPEND:
          store.append(action.getTarget(), token, payloadOf(action));
          break;
        default:
          throw new IllegalStateException("Unhandled store operation " + operation);
      }
      return ActionOutcome.completed(decision, data);
    } catch (PartitionNotFoundException e) {
      if (!snapshot.isAuditSuppressed()) {
        log.debug("Nothing stored for allowed action: requestId={}, kind={}",
          action.getRequestId(), action.getKind());
      }
      return ActionOutcome.failed(decision, e.getMessage());
    } catch (TokenInvalidException e) {
      if (!snapshot.isAuditSuppressed()) {
        log.warn("Store refused allowed action: requestId={}, actorId={}, kind={}, error={}",
          action.getRequestId(), action.getActorId(), action.getKind(), e.getMessage());
      }
      return ActionOutcome.failed(decision, e.getMessage());
    }
  }

  private Decision applyEffects(Actor actor, Action action, ModeSnapshot snapshot,
    Decision decision) {
    ActionKind kind = action.getKind();
    if (kind.isAgentCommunication()) {
      return communicationGuard.apply(action);
    }
    switch (kind) {
      case GRANT_READ:
        readGrants.grant(action.getTarget(), action.getCounterpartId());
        break;
      case REVOKE_READ:
        readGrants.revoke(action.getTarget(), action.getCounterpartId());
        break;
      case INTERNET_CALL:
        CapabilityGrant grant = enforcer.effectiveGrant(actor, snapshot.getMode());
        if (action.isConfirmed() && grant.getInternetAccess() == InternetAccess.TEMPORARY_SESSION) {
          modeController.confirmSession(actor.getId(), ActionKind.INTERNET_CALL);
        }
        break;
      default:
        break;
    }
    AccessOperation operation = kind.storeOperation();
    if (operation == null) {
      return decision;
    }
    return decision.withToken(tokenAuthority.issue(actor.getId(), action.getTarget(),
      action.effectiveKey(), operation));
  }

  private static byte[] payloadOf(Action action) {
    return action.getPayload() == null ? new byte[0] : action.getPayload();
  }

  private static final class Evaluation {

    private final ActionOutcome outcome;

    private final Mode mode;

    private final long epoch;

    private Evaluation(ActionOutcome outcome, Mode mode, long epoch) {
      this.outcome = outcome;
      this.mode = mode;
      this.epoch = epoch;
    }
  }
}
