package com.retrykit.core.cancel;

public enum CancellationReason {
  CANCELLED("cancelled"),
  DEADLINE_EXCEEDED("deadline exceeded"),
  INTERRUPTED("interrupted");

  private final String description;

  CancellationReason(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
