package com.retrykit.backoff;

import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.backoff.BackoffStep;
import java.util.Objects;

/** Stops after {@code maxRetries} retries, which allows {@code maxRetries + 1} attempts. */
public class MaxRetriesBackoff implements BackoffPolicy {
  private final BackoffPolicy delegate;
  private final long maxRetries;
  private long retries;

  public MaxRetriesBackoff(long maxRetries, BackoffPolicy delegate) {
    if (maxRetries < 0L) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.maxRetries = maxRetries;
    this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
  }

  @Override
  public BackoffStep next() {
    if (retries >= maxRetries) {
      return BackoffStep.stopped();
    }
    retries++;
    return delegate.next();
  }
}
