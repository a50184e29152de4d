package com.retrykit.backoff;

import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.backoff.BackoffStep;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Stops once {@code maxDuration} has passed since the policy was created. A delay that would run
 * past the budget is shortened to the time left.
 */
public class MaxDurationBackoff implements BackoffPolicy {
  private final BackoffPolicy delegate;
  private final Duration maxDuration;
  private final Clock clock;
  private final Instant started;

  public MaxDurationBackoff(Duration maxDuration, BackoffPolicy delegate) {
    this(maxDuration, delegate, Clock.systemUTC());
  }

  public MaxDurationBackoff(Duration maxDuration, BackoffPolicy delegate, Clock clock) {
    Objects.requireNonNull(maxDuration, "maxDuration must not be null");
    if (maxDuration.isNegative()) {
      throw new IllegalArgumentException("maxDuration must be >= 0");
    }
    this.maxDuration = maxDuration;
    this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.started = clock.instant();
  }

  @Override
  public BackoffStep next() {
    Duration remaining = maxDuration.minus(Duration.between(started, clock.instant()));
    if (remaining.isNegative() || remaining.isZero()) {
      return BackoffStep.stopped();
    }

    BackoffStep step = delegate.next();
    if (step.stop() || step.delay().compareTo(remaining) <= 0) {
      return step;
    }
    return BackoffStep.after(remaining);
  }
}
