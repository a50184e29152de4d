package com.retrykit.core.backoff;

import java.time.Duration;
import java.util.Objects;

public record BackoffStep(Duration delay, boolean stop) {
  private static final BackoffStep STOP = new BackoffStep(Duration.ZERO, true);

  public BackoffStep {
    Objects.requireNonNull(delay, "delay must not be null");
    if (delay.isNegative()) {
      delay = Duration.ZERO;
    }
  }

  public static BackoffStep stopped() {
    return STOP;
  }

  public static BackoffStep after(Duration delay) {
    return new BackoffStep(delay, false);
  }
}
