package com.github.spud.primus.interfaces.rest;

import com.github.spud.primus.domain.actor.UnknownActorException;
import com.github.spud.primus.domain.inference.InferenceUnavailableException;
import com.github.spud.primus.domain.memory.PartitionNotFoundException;
import com.github.spud.primus.domain.memory.TokenInvalidException;
import com.github.spud.primus.domain.sandbox.SandboxInactiveException;
import com.github.spud.primus.domain.state.ApprovalNotFoundException;
import com.github.spud.primus.domain.state.TransitionRejectedException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  public static class ErrorResponse {
    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(TransitionRejectedException.class)
  public ResponseEntity<ErrorResponse> handleTransitionRejected(TransitionRejectedException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("TRANSITION_REJECTED")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .details(Map.of("currentMode", e.getCurrentMode(), "event", e.getEvent()))
        .build();
    return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
  }

  @ExceptionHandler(UnknownActorException.class)
  public ResponseEntity<ErrorResponse> handleUnknownActor(UnknownActorException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("ACTOR_NOT_FOUND")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
  }

  @ExceptionHandler(ApprovalNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleApprovalNotFound(ApprovalNotFoundException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("APPROVAL_NOT_FOUND")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
  }

  @ExceptionHandler(SandboxInactiveException.class)
  public ResponseEntity<ErrorResponse> handleSandboxInactive(SandboxInactiveException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("SANDBOX_INACTIVE")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
  }

  @ExceptionHandler({TokenInvalidException.class, PartitionNotFoundException.class})
  public ResponseEntity<ErrorResponse> handleActionFailed(RuntimeException e) {
    log.warn("Action failed: {}", e.getMessage());
    ErrorResponse error = ErrorResponse.builder()
        .code("ACTION_FAILED")
        .message("action failed")
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
  }

  @ExceptionHandler(InferenceUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleInferenceUnavailable(InferenceUnavailableException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("INFERENCE_UNAVAILABLE")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }

    ErrorResponse error = ErrorResponse.builder()
        .code("VALIDATION_ERROR")
        .message("Request validation failed")
        .timestamp(OffsetDateTime.now())
        .details(Map.of("fieldErrors", fieldErrors))
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("INVALID_ARGUMENT")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    ErrorResponse error = ErrorResponse.builder()
        .code("INTERNAL_ERROR")
        .message("An unexpected error occurred")
        .timestamp(OffsetDateTime.now())
        .details(createDetailsMap(e))
        .build();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
  }

  private Map<String, Object> createDetailsMap(Exception e) {
    Map<String, Object> details = new HashMap<>();
    details.put("exception", e.getClass().getSimpleName());
    details.put("message", e.getMessage());
    if (e.getCause() != null) {
      details.put("cause", e.getCause().getMessage());
    }
    return details;
  }
}
