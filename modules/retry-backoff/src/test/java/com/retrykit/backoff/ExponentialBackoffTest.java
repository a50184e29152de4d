package com.retrykit.backoff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ExponentialBackoffTest {
  @Test
  void shouldMultiplyDelayOnEveryCall() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(100), 2.0d);

    assertEquals(Duration.ofMillis(100), backoff.next().delay());
    assertEquals(Duration.ofMillis(200), backoff.next().delay());
    assertEquals(Duration.ofMillis(400), backoff.next().delay());
    assertEquals(Duration.ofMillis(800), backoff.next().delay());
  }

  @Test
  void shouldTreatMultiplierBelowOneAsConstant() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(50), 0.5d);

    assertEquals(Duration.ofMillis(50), backoff.next().delay());
    assertEquals(Duration.ofMillis(50), backoff.next().delay());
  }

  @Test
  void shouldHoldAtCeilingInsteadOfOverflowing() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofDays(36500), 2.0d);

    assertEquals(Duration.ofDays(36500), backoff.next().delay());
    assertEquals(Duration.ofDays(73000), backoff.next().delay());
    assertEquals(Duration.ofNanos(Long.MAX_VALUE), backoff.next().delay());
    assertEquals(Duration.ofNanos(Long.MAX_VALUE), backoff.next().delay());
  }

  @Test
  void shouldStayAtZeroForZeroInitialBackoff() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ZERO, 2.0d);

    assertEquals(Duration.ZERO, backoff.next().delay());
    assertEquals(Duration.ZERO, backoff.next().delay());
  }

  @Test
  void shouldRejectNonFiniteMultiplier() {
    Duration initial = Duration.ofMillis(100);

    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(initial, Double.NaN));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ExponentialBackoff(initial, Double.POSITIVE_INFINITY));
  }
}
