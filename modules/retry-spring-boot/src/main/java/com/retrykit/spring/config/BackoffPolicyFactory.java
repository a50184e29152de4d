package com.retrykit.spring.config;

import com.retrykit.backoff.CappedDurationBackoff;
import com.retrykit.backoff.ConstantBackoff;
import com.retrykit.backoff.ExponentialBackoff;
import com.retrykit.backoff.FibonacciBackoff;
import com.retrykit.backoff.JitterBackoff;
import com.retrykit.backoff.MaxDurationBackoff;
import com.retrykit.backoff.MaxRetriesBackoff;
import com.retrykit.core.backoff.BackoffPolicy;
import com.retrykit.core.errors.ExceptionTypeClassifier;
import java.time.Duration;
import java.util.Locale;

public final class BackoffPolicyFactory {
  private BackoffPolicyFactory() {}

  public static BackoffPolicySupplier create(RetryProperties retry) {
    if (retry == null) {
      return () -> new MaxRetriesBackoff(0L, new ConstantBackoff(Duration.ZERO));
    }
    String mode =
        retry.getMode() == null ? "exponential" : retry.getMode().trim().toLowerCase(Locale.ROOT);
    if (!"constant".equals(mode) && !"exponential".equals(mode) && !"fibonacci".equals(mode)) {
      throw new IllegalArgumentException("Unsupported retry.mode: " + retry.getMode());
    }
    if (!Double.isFinite(retry.getMultiplier())) {
      throw new IllegalArgumentException(
          "retry.multiplier must be a finite number: " + retry.getMultiplier());
    }
    if (retry.getJitterPercent() < 0 || retry.getJitterPercent() > 100) {
      throw new IllegalArgumentException(
          "retry.jitter-percent must be between 0 and 100: " + retry.getJitterPercent());
    }

    Duration initialBackoff = Duration.ofMillis(Math.max(0L, retry.getInitialBackoffMs()));
    double multiplier = retry.getMultiplier();
    long maxRetries = retry.getMaxRetries();
    long maxBackoffMs = Math.max(0L, retry.getMaxBackoffMs());
    long maxElapsedMs = Math.max(0L, retry.getMaxElapsedMs());
    int jitterPercent = retry.getJitterPercent();

    return () -> {
      BackoffPolicy policy = basePolicy(mode, initialBackoff, multiplier);
      if (jitterPercent > 0) {
        policy = JitterBackoff.percent(jitterPercent, policy);
      }
      if (maxBackoffMs > 0L) {
        policy = new CappedDurationBackoff(Duration.ofMillis(maxBackoffMs), policy);
      }
      if (maxElapsedMs > 0L) {
        policy = new MaxDurationBackoff(Duration.ofMillis(maxElapsedMs), policy);
      }
      if (maxRetries >= 0L) {
        policy = new MaxRetriesBackoff(maxRetries, policy);
      }
      return policy;
    };
  }

  public static ExceptionTypeClassifier createClassifier(RetryProperties retry) {
    if (retry == null) {
      return ExceptionTypeClassifier.none();
    }
    return ExceptionTypeClassifier.fromClassNames(retry.getRetryableExceptions());
  }

  private static BackoffPolicy basePolicy(String mode, Duration initialBackoff, double multiplier) {
    switch (mode) {
      case "constant":
        return new ConstantBackoff(initialBackoff);
      case "fibonacci":
        return new FibonacciBackoff(initialBackoff);
      default:
        return new ExponentialBackoff(initialBackoff, multiplier);
    }
  }
}
