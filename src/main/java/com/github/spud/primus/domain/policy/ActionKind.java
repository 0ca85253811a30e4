package com.github.spud.primus.domain.policy;

import com.github.spud.primus.domain.memory.AccessOperation;

/**
 * Every kind of action an actor can request. The set is closed; the enforcer switches over it
 * exhaustively.
 */
public enum ActionKind {
  CHAT_TURN(false, null),
  MEMORY_READ(true, AccessOperation.READ),
  MEMORY_WRITE(true, AccessOperation.WRITE),
  MEMORY_APPEND(true, AccessOperation.APPEND),
  PERSONALITY_WRITE(true, AccessOperation.WRITE),
  SETTING_WRITE(true, AccessOperation.WRITE),
  GRANT_READ(true, null),
  REVOKE_READ(true, null),
  AGENT_MESSAGE(false, null),
  JOIN_COLLABORATION(false, null),
  SHARE_MEMORY(true, null),
  LEAVE_COLLABORATION(false, null),
  INTERNET_CALL(false, null);

  private final boolean targetsPartition;

  private final AccessOperation storeOperation;

  ActionKind(boolean targetsPartition, AccessOperation storeOperation) {
    this.targetsPartition = targetsPartition;
    this.storeOperation = storeOperation;
  }

  public boolean targetsPartition() {
    return targetsPartition;
  }

  /**
   * Store operation performed once the action is allowed, or {@code null} when the action never
   * touches partition bytes directly.
   */
  public AccessOperation storeOperation() {
    return storeOperation;
  }

  /**
   * Writes that change who the assistant is, which always need user confirmation.
   */
  public boolean isConfirmableWrite() {
    return this == PERSONALITY_WRITE || this == SETTING_WRITE;
  }

  public boolean isAgentCommunication() {
    return this == AGENT_MESSAGE || this == JOIN_COLLABORATION || this == SHARE_MEMORY
      || this == LEAVE_COLLABORATION;
  }
}
