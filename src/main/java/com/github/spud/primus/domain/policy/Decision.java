package com.github.spud.primus.domain.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.spud.primus.domain.memory.AccessToken;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

/**
 * Outcome of an enforcement decision. Denials are ordinary values, never exceptions.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Decision {

  DecisionType type;

  DecisionReason reason;

  String detail;

  /**
   * Single-use store token, present on allowed actions that touch partition bytes.
   */
  @With
  @JsonIgnore
  AccessToken token;

  /**
   * Id of the pending approval created for a {@link DecisionType#REQUIRE_APPROVAL} decision.
   */
  @With
  String approvalId;

  public static Decision allow() {
    return new Decision(DecisionType.ALLOW, DecisionReason.ALLOWED, null, null, null);
  }

  public static Decision deny(DecisionReason reason, String detail) {
    return new Decision(DecisionType.DENY, reason, detail, null, null);
  }

  public static Decision requireApproval(DecisionReason reason, String detail) {
    return new Decision(DecisionType.REQUIRE_APPROVAL, reason, detail, null, null);
  }

  public boolean isAllowed() {
    return type == DecisionType.ALLOW;
  }

  public boolean isDenied() {
    return type == DecisionType.DENY;
  }

  public boolean requiresApproval() {
    return type == DecisionType.REQUIRE_APPROVAL;
  }
}
