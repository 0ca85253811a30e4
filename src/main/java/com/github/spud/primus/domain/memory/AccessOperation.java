package com.github.spud.primus.domain.memory;

/**
 * Store operation a token is bound to.
 */
public enum AccessOperation {
  READ,
  WRITE,
  APPEND
}
