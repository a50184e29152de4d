package com.retrykit.core.executor;

import com.retrykit.core.cancel.CancellationSignal;

@FunctionalInterface
public interface RetryOperation<T> {
  T run(CancellationSignal signal) throws Exception;
}
