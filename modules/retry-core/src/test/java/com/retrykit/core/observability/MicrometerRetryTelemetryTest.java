package com.retrykit.core.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.retrykit.core.backoff.BackoffStep;
import com.retrykit.core.cancel.CancellationSignal;
import com.retrykit.core.errors.Retryable;
import com.retrykit.core.executor.RetryExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class MicrometerRetryTelemetryTest {
  @Test
  void shouldCountRetriesAndSessionOutcome() throws Exception {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    RetryExecutor executor = new RetryExecutor(new MicrometerRetryTelemetry(registry, "orders"));
    AtomicInteger attempts = new AtomicInteger();

    executor.execute(
        CancellationSignal.create(),
        () -> BackoffStep.after(Duration.ZERO),
        signal -> {
          if (attempts.incrementAndGet() < 3) {
            throw Retryable.mark(new IOException("transient"));
          }
          return "done";
        });

    assertEquals(
        2.0d,
        registry.get("retry.retries.total").tag("retry", "orders").counter().count());
    assertEquals(
        1.0d,
        registry.get("retry.sessions.total").tag("outcome", "success").counter().count());
    assertEquals(
        3.0d,
        registry.get("retry.attempts.total").tag("outcome", "success").counter().count());
    assertEquals(
        1L, registry.get("retry.session.duration").tag("outcome", "success").timer().count());
  }

  @Test
  void shouldTagExhaustedSessionsWithCauseType() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    RetryExecutor executor = new RetryExecutor(new MicrometerRetryTelemetry(registry, null));

    assertThrows(
        IOException.class,
        () ->
            executor.run(
                CancellationSignal.create(),
                BackoffStep::stopped,
                signal -> {
                  throw Retryable.mark(new IOException("down"));
                }));

    assertEquals(
        1.0d,
        registry
            .get("retry.sessions.total")
            .tag("retry", "default")
            .tag("outcome", "exhausted")
            .tag("error", "IOException")
            .counter()
            .count());
  }
}
