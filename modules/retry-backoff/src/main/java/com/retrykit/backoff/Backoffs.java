package com.retrykit.backoff;

import com.retrykit.core.backoff.BackoffPolicy;
import java.time.Clock;
import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Shorthand for building decorated policies, e.g.
 *
 * <pre>{@code
 * BackoffPolicy policy =
 *     Backoffs.withMaxRetries(5, Backoffs.withCappedDuration(Duration.ofSeconds(2),
 *         Backoffs.exponential(Duration.ofMillis(100))));
 * }</pre>
 */
public final class Backoffs {
  static final Duration MAX_DELAY = Duration.ofNanos(Long.MAX_VALUE);

  private Backoffs() {}

  public static BackoffPolicy constant(Duration backoff) {
    return new ConstantBackoff(backoff);
  }

  public static BackoffPolicy exponential(Duration initialBackoff) {
    return new ExponentialBackoff(initialBackoff, 2.0d);
  }

  public static BackoffPolicy fibonacci(Duration base) {
    return new FibonacciBackoff(base);
  }

  public static BackoffPolicy withMaxRetries(long maxRetries, BackoffPolicy delegate) {
    return new MaxRetriesBackoff(maxRetries, delegate);
  }

  public static BackoffPolicy withCappedDuration(Duration cap, BackoffPolicy delegate) {
    return new CappedDurationBackoff(cap, delegate);
  }

  public static BackoffPolicy withMaxDuration(Duration maxDuration, BackoffPolicy delegate) {
    return new MaxDurationBackoff(maxDuration, delegate);
  }

  public static BackoffPolicy withMaxDuration(
      Duration maxDuration, BackoffPolicy delegate, Clock clock) {
    return new MaxDurationBackoff(maxDuration, delegate, clock);
  }

  public static BackoffPolicy withJitter(Duration maxJitter, BackoffPolicy delegate) {
    return JitterBackoff.absolute(maxJitter, delegate);
  }

  public static BackoffPolicy withJitter(
      Duration maxJitter, BackoffPolicy delegate, DoubleSupplier jitterSource) {
    return JitterBackoff.absolute(maxJitter, delegate, jitterSource);
  }

  public static BackoffPolicy withJitterPercent(int percent, BackoffPolicy delegate) {
    return JitterBackoff.percent(percent, delegate);
  }

  public static BackoffPolicy withJitterPercent(
      int percent, BackoffPolicy delegate, DoubleSupplier jitterSource) {
    return JitterBackoff.percent(percent, delegate, jitterSource);
  }

  static long saturatedNanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException overflow) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }
}
