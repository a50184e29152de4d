package com.retrykit.core.backoff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffStepTest {
  @Test
  void shouldExposeStopFlagThroughAccessor() {
    BackoffStep stopped = BackoffStep.stopped();

    assertTrue(stopped.stop());
    assertSame(stopped, BackoffStep.stopped());
  }

  @Test
  void shouldCarryDelayWhenContinuing() {
    BackoffStep step = BackoffStep.after(Duration.ofMillis(250));

    assertFalse(step.stop());
    assertEquals(Duration.ofMillis(250), step.delay());
  }

  @Test
  void shouldClampNegativeDelayToZero() {
    assertEquals(Duration.ZERO, BackoffStep.after(Duration.ofMillis(-5)).delay());
  }

  @Test
  void shouldServeAsPolicyThroughMethodReference() {
    BackoffPolicy policy = BackoffStep::stopped;

    assertTrue(policy.next().stop());
  }
}
