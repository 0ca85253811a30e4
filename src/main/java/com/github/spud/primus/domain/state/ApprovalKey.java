package com.github.spud.primus.domain.state;

import com.github.spud.primus.domain.policy.ActionKind;
import lombok.Value;

/**
 * Actor and action kind of a pending approval or a confirmed session.
 */
@Value(staticConstructor = "of")
public class ApprovalKey {

  String actorId;

  ActionKind kind;
}
