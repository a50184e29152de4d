package com.retrykit.core.cancel;

import java.util.Objects;
import java.util.concurrent.CancellationException;

public class RetryCancelledException extends CancellationException {
  private final CancellationReason reason;

  public RetryCancelledException(CancellationReason reason) {
    super("retry " + Objects.requireNonNull(reason, "reason must not be null").description());
    this.reason = reason;
  }

  public RetryCancelledException(CancellationReason reason, Throwable cause) {
    this(reason);
    initCause(cause);
  }

  public CancellationReason reason() {
    return reason;
  }
}
