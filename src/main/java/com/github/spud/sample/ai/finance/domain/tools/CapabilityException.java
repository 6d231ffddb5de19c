package com.github.spud.sample.ai.finance.domain.tools;

/**
 * A capability could not produce a result: malformed or invalid arguments, or a failing data
 * lookup. Fed back to the model as an error payload, never propagated to the caller.
 */
public class CapabilityException extends RuntimeException {

  public CapabilityException(String message) {
    super(message);
  }

  public CapabilityException(String message, Throwable cause) {
    super(message, cause);
  }
}
