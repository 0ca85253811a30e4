package com.github.spud.primus.domain.policy;

/**
 * Why a decision came out the way it did. Shown verbatim by front ends.
 */
public enum DecisionReason {
  ALLOWED,
  UNKNOWN_ACTOR,
  INVALID_ACTION,
  CAPABILITY_MISSING,
  RAG_WRITE_FORBIDDEN,
  NOT_PARTITION_OWNER,
  CROSS_READ_NOT_GRANTED,
  PRIVATE_PARTITION_NOT_SHARED,
  SANDBOX_PARTITION_SEALED,
  SANDBOX_INACTIVE,
  SANDBOX_OFFLINE,
  PERSONALITY_WRITE_FORBIDDEN,
  INTERNET_DISABLED,
  AGENT_COMMUNICATION_DISABLED,
  PARTNER_NOT_AUTHORIZED,
  COLLABORATION_FULL,
  COLLABORATION_LIMIT_REACHED,
  NOT_IN_COLLABORATION,
  APPROVAL_PENDING,
  APPROVAL_REJECTED,
  CONFIRMATION_REQUIRED,
  HELD_UNTIL_SANDBOX_EXIT,
  MODE_CONTENTION
}
