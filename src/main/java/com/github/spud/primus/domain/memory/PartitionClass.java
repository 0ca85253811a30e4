package com.github.spud.primus.domain.memory;

/**
 * 记忆分区类别
 */
public enum PartitionClass {
  /**
   * 全局知识库，由 Primus 持有
   */
  GLOBAL,

  /**
   * Agent 私有 RAG
   */
  AGENT_PRIVATE,

  /**
   * 子会话历史
   */
  SUBCHAT,

  /**
   * 沙箱私有，沙箱外不可读，不进审计
   */
  SANDBOX_PRIVATE
}
