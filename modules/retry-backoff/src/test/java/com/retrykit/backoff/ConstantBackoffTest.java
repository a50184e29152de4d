package com.retrykit.backoff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.retrykit.core.backoff.BackoffStep;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConstantBackoffTest {
  @Test
  void shouldReturnSameDelayForever() {
    ConstantBackoff backoff = new ConstantBackoff(Duration.ofMillis(250));

    for (int i = 0; i < 10; i++) {
      BackoffStep step = backoff.next();
      assertFalse(step.stop());
      assertEquals(Duration.ofMillis(250), step.delay());
    }
  }

  @Test
  void shouldRejectNegativeBackoff() {
    assertThrows(IllegalArgumentException.class, () -> new ConstantBackoff(Duration.ofMillis(-1)));
  }
}
