package com.github.spud.primus.domain.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.spud.primus.domain.policy.Action;
import com.github.spud.primus.domain.policy.ActionKind;
import com.github.spud.primus.domain.policy.DecisionReason;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An action suspended until the user approves or rejects it.
 */
@Value
@Builder(toBuilder = true)
public class PendingApproval {

  String id;

  @JsonIgnore
  Action action;

  DecisionReason reason;

  ApprovalOrigin origin;

  Instant createdAt;

  public String getActorId() {
    return action.getActorId();
  }

  public ActionKind getKind() {
    return action.getKind();
  }

  public ApprovalKey key() {
    return ApprovalKey.of(getActorId(), getKind());
  }
}
