package com.retrykit.core.errors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class RetryableTest {
  @Test
  void shouldReturnNullWhenMarkingNull() {
    assertNull(Retryable.mark(null));
  }

  @Test
  void shouldUnwrapToOriginalException() {
    IOException original = new IOException("connection reset");

    RetryableException marked = Retryable.mark(original);

    assertSame(original, marked.unwrap());
    assertSame(original, marked.getCause());
    assertEquals("retryable: connection reset", marked.getMessage());
  }

  @Test
  void shouldNotWrapAnAlreadyMarkedException() {
    RetryableException marked = Retryable.mark(new IllegalStateException("busy"));

    assertSame(marked, Retryable.mark(marked));
  }

  @Test
  void shouldFindMarkerNestedInsideOtherWrappers() {
    IOException original = new IOException("timeout");
    RetryableException marked = Retryable.mark(original);
    Exception wrapped =
        new IllegalStateException(
            "service call failed",
            new UncheckedIOException("io", new IOException("layer", marked)));

    assertTrue(Retryable.isRetryable(wrapped));
    assertSame(marked, Retryable.find(wrapped).orElseThrow());
    assertSame(original, Retryable.find(wrapped).orElseThrow().unwrap());
  }

  @Test
  void shouldNotTreatPlainExceptionsAsRetryable() {
    assertFalse(Retryable.isRetryable(new IllegalArgumentException("bad input")));
    assertFalse(Retryable.isRetryable(null));
  }

  @Test
  void shouldStopOnCyclicCauseChains() {
    IllegalStateException first = new IllegalStateException("first");
    IllegalStateException second = new IllegalStateException("second", first);
    first.initCause(second);

    assertFalse(Retryable.isRetryable(second));
  }
}
