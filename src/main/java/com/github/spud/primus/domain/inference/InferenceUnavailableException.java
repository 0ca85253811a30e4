package com.github.spud.primus.domain.inference;

public class InferenceUnavailableException extends RuntimeException {

  public InferenceUnavailableException(String message) {
    super(message);
  }
}
