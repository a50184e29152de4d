package com.retrykit.spring.config;

import com.retrykit.core.backoff.BackoffPolicy;

/** Hands out a fresh policy per retry session; policies carry per-session state. */
@FunctionalInterface
public interface BackoffPolicySupplier {
  BackoffPolicy newPolicy();
}
