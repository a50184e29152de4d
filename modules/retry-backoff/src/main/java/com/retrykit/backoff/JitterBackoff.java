package com.retrykit.backoff;

import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.backoff.BackoffStep;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Moves each delay by a random amount. {@link #absolute} spreads by up to a fixed duration either
 * way, {@link #percent} by up to a share of the delay itself. Delays never go below zero.
 */
public class JitterBackoff implements BackoffPolicy {
  private final BackoffPolicy delegate;
  private final long maxJitterNanos;
  private final int percent;
  private final DoubleSupplier jitterSource;

  private JitterBackoff(
      BackoffPolicy delegate, long maxJitterNanos, int percent, DoubleSupplier jitterSource) {
    this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    this.maxJitterNanos = maxJitterNanos;
    this.percent = percent;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public static JitterBackoff absolute(Duration maxJitter, BackoffPolicy delegate) {
    return absolute(maxJitter, delegate, () -> ThreadLocalRandom.current().nextDouble());
  }

  public static JitterBackoff absolute(
      Duration maxJitter, BackoffPolicy delegate, DoubleSupplier jitterSource) {
    Objects.requireNonNull(maxJitter, "maxJitter must not be null");
    if (maxJitter.isNegative()) {
      throw new IllegalArgumentException("maxJitter must be >= 0");
    }
    return new JitterBackoff(delegate, Backoffs.saturatedNanos(maxJitter), 0, jitterSource);
  }

  public static JitterBackoff percent(int percent, BackoffPolicy delegate) {
    return percent(percent, delegate, () -> ThreadLocalRandom.current().nextDouble());
  }

  public static JitterBackoff percent(
      int percent, BackoffPolicy delegate, DoubleSupplier jitterSource) {
    if (percent < 0 || percent > 100) {
      throw new IllegalArgumentException("percent must be between 0 and 100");
    }
    return new JitterBackoff(delegate, 0L, percent, jitterSource);
  }

  @Override
  public BackoffStep next() {
    BackoffStep step = delegate.next();
    if (step.stop()) {
      return step;
    }

    long delayNanos = Backoffs.saturatedNanos(step.delay());
    long spread = percent > 0 ? (long) (delayNanos * (percent / 100.0d)) : maxJitterNanos;
    if (spread == 0L) {
      return step;
    }

    // factor in [-1, 1)
    double factor = Math.max(0.0d, Math.min(0.999999999d, jitterSource.getAsDouble())) * 2.0d - 1.0d;
    double jittered = delayNanos + factor * spread;
    if (jittered <= 0.0d) {
      return BackoffStep.after(Duration.ZERO);
    }
    if (jittered >= Long.MAX_VALUE) {
      return BackoffStep.after(Backoffs.MAX_DELAY);
    }
    return BackoffStep.after(Duration.ofNanos((long) jittered));
  }
}
