package com.github.spud.primus.domain.state;

public class ApprovalNotFoundException extends RuntimeException {

  public ApprovalNotFoundException(String approvalId) {
    super("Approval not found: " + approvalId);
  }
}
