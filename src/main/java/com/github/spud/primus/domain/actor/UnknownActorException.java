package com.github.spud.primus.domain.actor;

public class UnknownActorException extends RuntimeException {

  public UnknownActorException(String actorId) {
    super("Actor not found: " + actorId);
  }
}
