package com.retrykit.core.observability;

import java.time.Duration;

public interface RetryTelemetry {
  void onRetryScheduled(int attempt, Duration delay, Throwable cause);

  void onSuccess(int attempts, long durationNanos);

  /** {@code error} is the exception the caller receives for this outcome. */
  void onFailure(RetryOutcome outcome, int attempts, Throwable error, long durationNanos);
}
