package com.retrykit.core.executor;

import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.backoff.BackoffStep;
import com.retrykit.core.cancel.CancellationReason;
import com.retrykit.core.cancel.CancellationSignal;
import com.retrykit.core.cancel.RetryCancelledException;
import com.retrykit.core.errors.RetryableException;
import com.retrykit.core.errors.Retryable;
import com.retrykit.core.observability.NoOpRetryTelemetry;
import com.retrykit.core.observability.RetryOutcome;
import com.retrykit.core.observability.RetryTelemetry;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs an operation until it succeeds, throws an exception that is not marked with {@link
 * Retryable#mark}, exhausts its {@link BackoffPolicy}, or the {@link CancellationSignal} fires.
 *
 * <p>Exhaustion rethrows the marker's cause, never the marker. Cancellation surfaces as {@link
 * RetryCancelledException} and is never retried. The executor holds no per-session state and may be
 * shared; the policy passed to each call may not.
 */
public class RetryExecutor {
  private final RetryTelemetry telemetry;

  public RetryExecutor() {
    this(new NoOpRetryTelemetry());
  }

  public RetryExecutor(RetryTelemetry telemetry) {
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
  }

  public void run(CancellationSignal signal, BackoffPolicy policy, RetryableRunnable operation)
      throws Exception {
    Objects.requireNonNull(operation, "operation must not be null");
    execute(
        signal,
        policy,
        current -> {
          operation.run(current);
          return null;
        });
  }

  public <T> T execute(CancellationSignal signal, BackoffPolicy policy, RetryOperation<T> operation)
      throws Exception {
    Objects.requireNonNull(signal, "signal must not be null");
    Objects.requireNonNull(policy, "policy must not be null");
    Objects.requireNonNull(operation, "operation must not be null");

    long started = System.nanoTime();
    int attempt = 0;
    while (true) {
      if (signal.isCancelled()) {
        throw cancelled(signal.toException(), attempt, started);
      }

      attempt++;
      T result = null;
      Exception failure = null;
      try {
        result = operation.run(signal);
      } catch (Exception ex) {
        failure = ex;
      }
      if (failure == null) {
        telemetry.onSuccess(attempt, System.nanoTime() - started);
        return result;
      }

      Optional<RetryableException> marker = Retryable.find(failure);
      if (marker.isEmpty()) {
        telemetry.onFailure(
            RetryOutcome.NON_RETRYABLE, attempt, failure, System.nanoTime() - started);
        throw failure;
      }
      Exception cause = marker.get().unwrap();

      BackoffStep step = policy.next();
      if (step.stop()) {
        telemetry.onFailure(RetryOutcome.EXHAUSTED, attempt, cause, System.nanoTime() - started);
        throw cause;
      }

      // checked on its own so an already-cancelled signal never starts a wait
      if (signal.isCancelled()) {
        throw cancelled(signal.toException(), attempt, started);
      }

      telemetry.onRetryScheduled(attempt, step.delay(), cause);
      awaitBackoff(signal, step.delay(), attempt, started);
    }
  }

  private void awaitBackoff(CancellationSignal signal, Duration delay, int attempt, long started) {
    boolean cancelledDuringWait;
    try {
      cancelledDuringWait = signal.awaitCancellation(delay);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw cancelled(
          new RetryCancelledException(CancellationReason.INTERRUPTED, interrupted),
          attempt,
          started);
    }
    if (cancelledDuringWait) {
      throw cancelled(signal.toException(), attempt, started);
    }
  }

  private RetryCancelledException cancelled(
      RetryCancelledException exception, int attempts, long started) {
    telemetry.onFailure(RetryOutcome.CANCELLED, attempts, exception, System.nanoTime() - started);
    return exception;
  }
}
