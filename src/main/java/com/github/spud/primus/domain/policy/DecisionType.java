package com.github.spud.primus.domain.policy;

/**
 * 判定结果类型
 */
public enum DecisionType {
  ALLOW,
  DENY,
  REQUIRE_APPROVAL
}
