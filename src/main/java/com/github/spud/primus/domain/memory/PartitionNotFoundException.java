package com.github.spud.primus.domain.memory;

public class PartitionNotFoundException extends RuntimeException {

  public PartitionNotFoundException(String message) {
    super(message);
  }
}
