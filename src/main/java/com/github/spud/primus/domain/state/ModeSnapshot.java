package com.github.spud.primus.domain.state;

import com.github.spud.primus.domain.policy.ActionKind;
import java.util.Set;
import lombok.Value;

/**
 * Mode state observed by one evaluation. Valid only while the mode read lock is held; the epoch
 * tells whether the state changed after the lock was released.
 */
@Value
public class ModeSnapshot {

  Mode mode;

  long epoch;

  Set<ApprovalKey> pending;

  Set<ApprovalKey> confirmedSessions;

  public boolean isAuditSuppressed() {
    return mode == Mode.SANDBOX;
  }

  public boolean isSandbox() {
    return mode == Mode.SANDBOX;
  }

  public boolean hasPending(String actorId, ActionKind kind) {
    return pending.contains(ApprovalKey.of(actorId, kind));
  }

  public boolean isSessionConfirmed(String actorId, ActionKind kind) {
    return confirmedSessions.contains(ApprovalKey.of(actorId, kind));
  }
}
