package com.github.spud.primus.domain.state;

/**
 * 待确认请求的来源
 */
public enum ApprovalOrigin {
  /**
   * 正常模式下发起
   */
  DIRECT,

  /**
   * 沙箱中发起，退出沙箱时提交确认
   */
  SANDBOX_EDIT
}
