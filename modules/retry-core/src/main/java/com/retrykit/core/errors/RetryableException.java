package com.retrykit.core.errors;

import java.util.Objects;

/**
 * Marks its cause as eligible for another attempt. Only the executor looks at this type; once the
 * backoff policy gives up, the cause is rethrown instead of the marker.
 */
public class RetryableException extends RuntimeException {
  private final Exception cause;

  public RetryableException(Exception cause) {
    super(describe(cause), Objects.requireNonNull(cause, "cause must not be null"));
    this.cause = cause;
  }

  public Exception unwrap() {
    return cause;
  }

  private static String describe(Exception cause) {
    if (cause == null) {
      return "retryable: <null>";
    }
    String message = cause.getMessage();
    if (message == null || message.isBlank()) {
      return "retryable: " + cause.getClass().getName();
    }
    return "retryable: " + message;
  }
}
