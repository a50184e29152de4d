package com.retrykit.backoff;

import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.backoff.BackoffStep;
import java.time.Duration;
import java.util.Objects;

public class CappedDurationBackoff implements BackoffPolicy {
  private final BackoffPolicy delegate;
  private final Duration cap;

  public CappedDurationBackoff(Duration cap, BackoffPolicy delegate) {
    Objects.requireNonNull(cap, "cap must not be null");
    if (cap.isNegative()) {
      throw new IllegalArgumentException("cap must be >= 0");
    }
    this.cap = cap;
    this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
  }

  @Override
  public BackoffStep next() {
    BackoffStep step = delegate.next();
    if (step.stop() || step.delay().compareTo(cap) <= 0) {
      return step;
    }
    return BackoffStep.after(cap);
  }
}
