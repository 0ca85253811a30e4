package com.github.spud.primus.domain.audit;

import com.github.spud.primus.domain.policy.ActionKind;
import com.github.spud.primus.domain.policy.DecisionReason;
import com.github.spud.primus.domain.policy.DecisionType;
import com.github.spud.primus.domain.state.Mode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One enforcement decision as it appears in the audit trail. Immutable once appended.
 */
@Value
@Builder
@Jacksonized
public class AuditRecord {

  long sequence;

  Instant timestamp;

  String actorId;

  ActionKind kind;

  DecisionType decision;

  DecisionReason reason;

  String detail;

  String approvalId;

  /**
   * Mode the decision was made in
   */
  Mode mode;
}
