package com.github.spud.primus.domain.state;

import lombok.Getter;

/**
 * A mode change was requested that the transition graph or the current approvals do not allow.
 */
@Getter
public class TransitionRejectedException extends RuntimeException {

  private final Mode currentMode;

  private final ModeEvent event;

  public TransitionRejectedException(Mode currentMode, ModeEvent event, String message) {
    super(message);
    this.currentMode = currentMode;
    this.event = event;
  }
}
