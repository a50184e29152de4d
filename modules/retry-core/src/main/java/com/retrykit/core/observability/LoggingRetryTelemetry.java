package com.retrykit.core.observability;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingRetryTelemetry implements RetryTelemetry {
  private static final Logger log = LoggerFactory.getLogger(LoggingRetryTelemetry.class);

  private final String name;

  public LoggingRetryTelemetry(String name) {
    this.name = name == null || name.isBlank() ? "default" : name;
  }

  @Override
  public void onRetryScheduled(int attempt, Duration delay, Throwable cause) {
    log.debug(
        "Retry scheduled retry={} attempt={} delayMs={} error={}",
        name,
        attempt,
        delay.toMillis(),
        safeMessage(cause));
  }

  @Override
  public void onSuccess(int attempts, long durationNanos) {
    if (attempts > 1) {
      log.debug(
          "Retry succeeded retry={} attempts={} durationMs={}",
          name,
          attempts,
          Duration.ofNanos(durationNanos).toMillis());
    }
  }

  @Override
  public void onFailure(RetryOutcome outcome, int attempts, Throwable error, long durationNanos) {
    long durationMs = Duration.ofNanos(Math.max(0L, durationNanos)).toMillis();
    switch (outcome) {
      case EXHAUSTED ->
          log.warn(
              "Retries exhausted retry={} attempts={} durationMs={} error={}",
              name,
              attempts,
              durationMs,
              safeMessage(error));
      case CANCELLED ->
          log.info(
              "Retry cancelled retry={} attempts={} durationMs={} reason={}",
              name,
              attempts,
              durationMs,
              safeMessage(error));
      default ->
          log.debug(
              "Non-retryable failure retry={} attempts={} error={}",
              name,
              attempts,
              safeMessage(error));
    }
  }

  private static String safeMessage(Throwable error) {
    if (error == null) {
      return "none";
    }
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    return message;
  }
}
