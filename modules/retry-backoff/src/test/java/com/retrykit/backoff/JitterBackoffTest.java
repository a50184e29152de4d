package com.retrykit.backoff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.retrykit.core.backoff.BackoffStep;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class JitterBackoffTest {
  private final ConstantBackoff oneSecond = new ConstantBackoff(Duration.ofSeconds(1));

  @Test
  void shouldSpreadByAbsoluteAmountInBothDirections() {
    assertEquals(
        Duration.ofMillis(900),
        JitterBackoff.absolute(Duration.ofMillis(100), oneSecond, () -> 0.0d).next().delay());
    assertEquals(
        Duration.ofSeconds(1),
        JitterBackoff.absolute(Duration.ofMillis(100), oneSecond, () -> 0.5d).next().delay());
    assertEquals(
        Duration.ofMillis(1050),
        JitterBackoff.absolute(Duration.ofMillis(100), oneSecond, () -> 0.75d).next().delay());
  }

  @Test
  void shouldSpreadByPercentOfDelay() {
    assertEquals(
        Duration.ofMillis(800), JitterBackoff.percent(20, oneSecond, () -> 0.0d).next().delay());
  }

  @Test
  void shouldNeverGoBelowZero() {
    JitterBackoff backoff =
        JitterBackoff.absolute(
            Duration.ofSeconds(5), new ConstantBackoff(Duration.ofMillis(10)), () -> 0.0d);

    assertEquals(Duration.ZERO, backoff.next().delay());
  }

  @Test
  void shouldKeepStopFromDelegate() {
    assertTrue(JitterBackoff.percent(50, BackoffStep::stopped, () -> 0.3d).next().stop());
  }

  @Test
  void shouldRejectOutOfRangePercent() {
    assertThrows(IllegalArgumentException.class, () -> JitterBackoff.percent(101, oneSecond));
    assertThrows(IllegalArgumentException.class, () -> JitterBackoff.percent(-1, oneSecond));
  }
}
