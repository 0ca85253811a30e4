package com.github.spud.primus.domain.sandbox;

public class SandboxInactiveException extends RuntimeException {

  public SandboxInactiveException() {
    super("Sandbox mode is not active");
  }
}
