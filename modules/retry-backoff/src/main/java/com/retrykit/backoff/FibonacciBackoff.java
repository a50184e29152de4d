package com.retrykit.backoff;

import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.backoff.BackoffStep;
import java.time.Duration;
import java.util.Objects;

/** {@code base, base, 2*base, 3*base, 5*base, ...}, holding at the ceiling once it overflows. */
public class FibonacciBackoff implements BackoffPolicy {
  private long previousNanos;
  private long currentNanos;

  public FibonacciBackoff(Duration base) {
    Objects.requireNonNull(base, "base must not be null");
    this.previousNanos = 0L;
    this.currentNanos = Math.max(0L, Backoffs.saturatedNanos(base));
  }

  @Override
  public BackoffStep next() {
    long delay = currentNanos;
    long following;
    try {
      following = Math.addExact(previousNanos, currentNanos);
    } catch (ArithmeticException overflow) {
      following = Long.MAX_VALUE;
    }
    previousNanos = currentNanos;
    currentNanos = following;
    return BackoffStep.after(Duration.ofNanos(delay));
  }
}
