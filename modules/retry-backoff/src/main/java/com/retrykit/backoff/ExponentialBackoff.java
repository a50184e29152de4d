package com.retrykit.backoff;

import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.backoff.BackoffStep;
import java.time.Duration;
import java.util.Objects;

/**
 * {@code initial * multiplier^n} for the n-th retry, starting at n = 0. Never stops on its own;
 * once the product no longer fits in a {@link Duration} of nanoseconds it stays at that ceiling.
 */
public class ExponentialBackoff implements BackoffPolicy {
  private final long initialNanos;
  private final double multiplier;
  private int exponent;
  private boolean saturated;

  public ExponentialBackoff(Duration initialBackoff, double multiplier) {
    Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    if (!Double.isFinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be finite: " + multiplier);
    }
    this.initialNanos = Math.max(0L, Backoffs.saturatedNanos(initialBackoff));
    this.multiplier = Math.max(1.0d, multiplier);
  }

  @Override
  public BackoffStep next() {
    if (initialNanos == 0L) {
      return BackoffStep.after(Duration.ZERO);
    }
    if (saturated) {
      return BackoffStep.after(Backoffs.MAX_DELAY);
    }

    double scaled = initialNanos * Math.pow(multiplier, exponent);
    if (scaled >= Long.MAX_VALUE) {
      saturated = true;
      return BackoffStep.after(Backoffs.MAX_DELAY);
    }
    exponent++;
    return BackoffStep.after(Duration.ofNanos((long) scaled));
  }
}
