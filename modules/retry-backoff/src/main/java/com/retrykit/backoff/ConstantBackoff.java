package com.retrykit.backoff;

import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.backoff.BackoffStep;
import java.time.Duration;
import java.util.Objects;

/** Same delay before every retry, forever. Stateless, so one instance may be shared. */
public class ConstantBackoff implements BackoffPolicy {
  private final BackoffStep step;

  public ConstantBackoff(Duration backoff) {
    Objects.requireNonNull(backoff, "backoff must not be null");
    if (backoff.isNegative()) {
      throw new IllegalArgumentException("backoff must be >= 0");
    }
    this.step = BackoffStep.after(backoff);
  }

  @Override
  public BackoffStep next() {
    return step;
  }
}
