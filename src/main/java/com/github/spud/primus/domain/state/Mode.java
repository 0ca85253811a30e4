package com.github.spud.primus.domain.state;

/**
 * 全局运行模式
 * <pre>
 * NORMAL → APPROVAL_PENDING → NORMAL
 * NORMAL → SANDBOX → NORMAL
 * </pre>
 */
public enum Mode {
  /**
   * 正常模式
   */
  NORMAL,

  /**
   * 存在待用户确认的请求
   */
  APPROVAL_PENDING,

  /**
   * Captain's Log 沙箱模式：离线，不写审计
   */
  SANDBOX
}
