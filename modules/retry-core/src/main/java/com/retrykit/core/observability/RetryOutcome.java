package com.retrykit.core.observability;

import java.util.Locale;

public enum RetryOutcome {
  SUCCESS,
  NON_RETRYABLE,
  EXHAUSTED,
  CANCELLED;

  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
