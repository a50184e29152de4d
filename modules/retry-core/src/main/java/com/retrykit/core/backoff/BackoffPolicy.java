package com.retrykit.core.backoff;

/**
 * Strategy producing the successive waits of one retry session.
 *
 * <p>Each call to {@link #next()} advances the policy's internal state. A policy is created fresh
 * for every session and is not safe for concurrent use unless the implementation says so.
 * Decorators wrap another policy and satisfy the same contract, so policies compose by wrapping.
 */
@FunctionalInterface
public interface BackoffPolicy {
  /**
   * Returns the wait before the next attempt, or {@link BackoffStep#stopped()} once the policy
   * has no budget left. Never throws: a policy that cannot compute a delay stops.
   */
  BackoffStep next();
}
