package com.github.spud.sample.ai.finance.domain.agent;

/**
 * The completion service failed or returned nothing usable. Aborts the whole run, including every
 * enclosing delegation.
 */
public class CompletionServiceException extends RuntimeException {

  public CompletionServiceException(String message) {
    super(message);
  }

  public CompletionServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
