package com.retrykit.core.observability;

import java.time.Duration;

public class NoOpRetryTelemetry implements RetryTelemetry {
    @Override
    public void onRetryScheduled(int attempt, Duration delay, Throwable cause) {
    }

    @Override
    public void onSuccess(int attempts, long durationNanos) {
    }

    @Override
    public void onFailure(RetryOutcome outcome, int attempts, Throwable error, long durationNanos) {
    }
}
