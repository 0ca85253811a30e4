package com.github.spud.primus.domain.memory;

/**
 * Raised when a store operation presents a token that was never issued, was already used, has
 * expired, or is bound to a different partition, key or operation.
 */
public class TokenInvalidException extends RuntimeException {

  public TokenInvalidException(String message) {
    super(message);
  }
}
