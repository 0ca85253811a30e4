package com.github.spud.primus.domain.sandbox;

public class CipherException extends RuntimeException {

  public CipherException(String message, Throwable cause) {
    super(message, cause);
  }
}
