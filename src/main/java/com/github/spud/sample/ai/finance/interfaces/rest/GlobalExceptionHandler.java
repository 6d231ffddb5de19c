package com.github.spud.sample.ai.finance.interfaces.rest;

import com.github.spud.sample.ai.finance.domain.agent.CompletionServiceException;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccessException;
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
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps chat failures onto {@link ErrorResponse} bodies. Capability failures never reach this
 * point; they are fed back to the model instead.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final String CHAT_FAILURE_PREFIX = "Error processing chat message: ";

  @Data
  @Builder
  public static class ErrorResponse {
    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(CompletionServiceException.class)
  public ResponseEntity<ErrorResponse> handleCompletionService(CompletionServiceException e) {
    log.error("Completion service failure: {}", e.getMessage());
    return respond(HttpStatus.BAD_GATEWAY, "UPSTREAM_FAILURE", CHAT_FAILURE_PREFIX + e.getMessage(),
      null);
  }

  @ExceptionHandler(FinanceDataAccessException.class)
  public ResponseEntity<ErrorResponse> handleDataAccess(FinanceDataAccessException e) {
    log.error("Finance data unavailable: {}", e.getMessage());
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "DATA_UNAVAILABLE",
      CHAT_FAILURE_PREFIX + e.getMessage(), null);
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
    }
    return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed",
      Map.of("fieldErrors", fieldErrors));
  }

  /**
   * Missing or non-numeric caller header, unreadable body
   */
  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getReason(), null);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage(), null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    Map<String, Object> details = new HashMap<>();
    details.put("exception", e.getClass().getSimpleName());
    if (e.getCause() != null) {
      details.put("cause", e.getCause().getMessage());
    }
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
      CHAT_FAILURE_PREFIX + e.getMessage(), details);
  }

  private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code,
    String message, Map<String, Object> details) {
    ErrorResponse body = ErrorResponse.builder()
      .code(code)
      .message(message)
      .timestamp(OffsetDateTime.now())
      .details(details)
      .build();
    return ResponseEntity.status(status).body(body);
  }
}
