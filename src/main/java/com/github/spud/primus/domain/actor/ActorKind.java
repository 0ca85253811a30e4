package com.github.spud.primus.domain.actor;

import com.github.spud.primus.domain.memory.PartitionClass;

/**
 * 参与者类型（封闭集合）
 */
public enum ActorKind {
  /**
   * 主助手
   */
  PRIMUS(PartitionClass.GLOBAL),

  /**
   * 专用 Agent
   */
  AGENT(PartitionClass.AGENT_PRIVATE),

  /**
   * 派生子会话
   */
  SUBCHAT(PartitionClass.SUBCHAT),

  /**
   * Captain's Log 沙箱
   */
  SANDBOX(PartitionClass.SANDBOX_PRIVATE);

  private final PartitionClass ownPartitionClass;

  ActorKind(PartitionClass ownPartitionClass) {
    this.ownPartitionClass = ownPartitionClass;
  }

  public PartitionClass ownPartitionClass() {
    return ownPartitionClass;
  }
}
