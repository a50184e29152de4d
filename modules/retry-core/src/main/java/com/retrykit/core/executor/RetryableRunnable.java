package com.retrykit.core.executor;

import com.retrykit.core.cancel.CancellationSignal;

@FunctionalInterface
public interface RetryableRunnable {
  void run(CancellationSignal signal) throws Exception;
}
