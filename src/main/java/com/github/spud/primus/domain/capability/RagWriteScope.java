package com.github.spud.primus.domain.capability;

/**
 * RAG 写入范围
 */
public enum RagWriteScope {
  /**
   * 禁止写入
   */
  NONE,

  /**
   * 只能写入自己的分区
   */
  OWN_PARTITION_ONLY;

  public RagWriteScope narrowest(RagWriteScope other) {
    if (other == null) {
      return this;
    }
    return this.ordinal() <= other.ordinal() ? this : other;
  }
}
