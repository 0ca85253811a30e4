package com.github.spud.primus.domain.state;

/**
 * 模式状态机事件
 */
public enum ModeEvent {
  /**
   * 出现第一个待确认请求
   */
  REQUIRE_APPROVAL,

  /**
   * 所有待确认请求均已处理
   */
  APPROVALS_RESOLVED,

  /**
   * 用户显式进入沙箱
   */
  ENTER_SANDBOX,

  /**
   * 用户显式退出沙箱
   */
  EXIT_SANDBOX
}
