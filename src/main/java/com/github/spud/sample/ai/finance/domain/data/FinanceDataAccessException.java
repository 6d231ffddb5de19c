package com.github.spud.sample.ai.finance.domain.data;

/**
 * A read against the finance data store failed, or was asked with arguments it cannot answer.
 */
public class FinanceDataAccessException extends RuntimeException {

  public FinanceDataAccessException(String message) {
    super(message);
  }

  public FinanceDataAccessException(String message, Throwable cause) {
    super(message, cause);
  }
}
