package com.retrykit.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public class MicrometerRetryTelemetry implements RetryTelemetry {
  private final MeterRegistry meterRegistry;
  private final String name;

  public MicrometerRetryTelemetry(MeterRegistry meterRegistry, String name) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.name = safeValue(name);
  }

  @Override
  public void onRetryScheduled(int attempt, Duration delay, Throwable cause) {
    Counter.builder("retry.retries.total")
        .description("Total retries scheduled after a retryable failure")
        .tag("retry", name)
        .tag("error", safeError(cause))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onSuccess(int attempts, long durationNanos) {
    record(RetryOutcome.SUCCESS, attempts, "none", durationNanos);
  }

  @Override
  public void onFailure(RetryOutcome outcome, int attempts, Throwable error, long durationNanos) {
    record(outcome, attempts, safeError(error), durationNanos);
  }

  private void record(RetryOutcome outcome, int attempts, String error, long durationNanos) {
    Counter.builder("retry.sessions.total")
        .description("Total retry sessions by outcome")
        .tag("retry", name)
        .tag("outcome", outcome.tagValue())
        .tag("error", error)
        .register(meterRegistry)
        .increment();

    Counter.builder("retry.attempts.total")
        .description("Total operation attempts by session outcome")
        .tag("retry", name)
        .tag("outcome", outcome.tagValue())
        .register(meterRegistry)
        .increment(Math.max(0, attempts));

    Timer.builder("retry.session.duration")
        .description("Retry session latency including backoff waits")
        .tag("retry", name)
        .tag("outcome", outcome.tagValue())
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "default";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
