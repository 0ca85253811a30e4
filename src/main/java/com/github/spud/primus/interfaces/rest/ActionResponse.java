package com.github.spud.primus.interfaces.rest;

import com.github.spud.primus.domain.guard.ActionOutcome;
import com.github.spud.primus.domain.policy.Decision;
import com.github.spud.primus.domain.policy.DecisionReason;
import com.github.spud.primus.domain.policy.DecisionType;
import java.nio.charset.StandardCharsets;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ActionResponse {

  private DecisionType decision;

  private DecisionReason reason;

  private String detail;

  private String approvalId;

  private ActionOutcome.Status status;

  private String data;

  private String error;

  static ActionResponse of(Decision decision) {
    return ActionResponse.builder()
      .decision(decision.getType())
      .reason(decision.getReason())
      .detail(decision.getDetail())
      .approvalId(decision.getApprovalId())
      .build();
  }

  static ActionResponse of(ActionOutcome outcome) {
    ActionResponse response = of(outcome.getDecision());
    response.setStatus(outcome.getStatus());
    response.setError(outcome.getError());
    if (outcome.getData() != null) {
      response.setData(new String(outcome.getData(), StandardCharsets.UTF_8));
    }
    return response;
  }
}
