package com.github.spud.primus.domain.guard;

import com.github.spud.primus.domain.policy.Decision;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of executing an action: the decision plus, for store operations, what the store did.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ActionOutcome {

  public enum Status {
    /**
     * Allowed and carried out
     */
    COMPLETED,
    /**
     * Denied or suspended; nothing was executed
     */
    NOT_EXECUTED,
    /**
     * Allowed, but the store refused the operation
     */
    FAILED
  }

  Decision decision;

  Status status;

  byte[] data;

  String error;

  static ActionOutcome notExecuted(Decision decision) {
    return new ActionOutcome(decision, Status.NOT_EXECUTED, null, null);
  }

  static ActionOutcome completed(Decision decision, byte[] data) {
    return new ActionOutcome(decision, Status.COMPLETED, data, null);
  }

  static ActionOutcome failed(Decision decision, String error) {
    return new ActionOutcome(decision, Status.FAILED, null, "action failed: " + error);
  }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }
}
