package com.github.spud.primus.domain.capability;

/**
 * 外网访问级别，按权限从小到大排列
 */
public enum InternetAccess {
  /**
   * 禁止联网
   */
  OFF,

  /**
   * 每次调用都需要用户确认
   */
  PER_CALL,

  /**
   * 本会话内确认一次即可
   */
  TEMPORARY_SESSION;

  public InternetAccess narrowest(InternetAccess other) {
    if (other == null) {
      return this;
    }
    return this.ordinal() <= other.ordinal() ? this : other;
  }

  public boolean permits(InternetAccess other) {
    return other == null || other.ordinal() <= this.ordinal();
  }
}
