package com.retrykit.core.errors;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;

public final class Retryable {
  private Retryable() {}

  /**
   * Wraps {@code exception} so the executor retries it. Returns {@code null} for {@code null} and
   * the argument itself when it is already a marker, so a final error never carries two layers.
   */
  public static RetryableException mark(Exception exception) {
    if (exception == null) {
      return null;
    }
    if (exception instanceof RetryableException marker) {
      return marker;
    }
    return new RetryableException(exception);
  }

  public static boolean isRetryable(Throwable error) {
    return find(error).isPresent();
  }

  /** Outermost marker in the cause chain of {@code error}, including {@code error} itself. */
  public static Optional<RetryableException> find(Throwable error) {
    Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable candidate = error;
    while (candidate != null && visited.add(candidate)) {
      if (candidate instanceof RetryableException marker) {
        return Optional.of(marker);
      }
      candidate = candidate.getCause();
    }
    return Optional.empty();
  }
}
