package com.github.spud.primus.domain.guard;

import com.github.spud.primus.domain.actor.ActorKind;
import com.github.spud.primus.domain.capability.CapabilityGrant;
import com.github.spud.primus.domain.state.Mode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PermissionReport {

  String actorId;

  ActorKind kind;

  Mode mode;

  /**
   * Narrowing applied at runtime, {@code null} when the template applies unchanged.
   */
  CapabilityGrant runtimeGrant;

  CapabilityGrant effectiveGrant;

  String collaboration;

  int pendingApprovals;
}
