package com.retrykit.core.cancel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One-way cancellation trigger shared by an operation and the executor driving it.
 *
 * <p>Once cancelled a signal stays cancelled and keeps the first reason it was given. Waiting
 * happens on a latch, so a cancel that lands while a backoff wait is running wakes the waiter and
 * a cancel that lands before the wait starts makes the wait return immediately.
 */
public final class CancellationSignal {
  private final CountDownLatch latch = new CountDownLatch(1);
  private final Object lock = new Object();
  private final List<Runnable> listeners = new ArrayList<>();
  private volatile CancellationReason reason;

  private CancellationSignal() {}

  public static CancellationSignal create() {
    return new CancellationSignal();
  }

  public boolean cancel() {
    return cancel(CancellationReason.CANCELLED);
  }

  /**
   * Returns {@code false} when the signal was already cancelled. Every registered listener runs
   * even if an earlier one throws; the first failure is rethrown afterwards.
   */
  public boolean cancel(CancellationReason cancellationReason) {
    Objects.requireNonNull(cancellationReason, "cancellationReason must not be null");
    List<Runnable> toNotify;
    synchronized (lock) {
      if (reason != null) {
        return false;
      }
      reason = cancellationReason;
      toNotify = new ArrayList<>(listeners);
      listeners.clear();
    }

    // waiters are released only after every listener has run
    RuntimeException failure = null;
    for (Runnable listener : toNotify) {
      try {
        listener.run();
      } catch (RuntimeException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    latch.countDown();
    if (failure != null) {
      throw failure;
    }
    return true;
  }

  public boolean isCancelled() {
    return reason != null;
  }

  public CancellationReason reason() {
    return reason;
  }

  /**
   * Runs {@code listener} once on cancellation, or right away if already cancelled. The returned
   * registration drops the listener when it is no longer needed.
   */
  public Registration onCancel(Runnable listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    synchronized (lock) {
      if (reason == null) {
        listeners.add(listener);
        return () -> removeListener(listener);
      }
    }
    listener.run();
    return () -> {};
  }

  /**
   * Blocks until the signal is cancelled or {@code timeout} elapses.
   *
   * @return {@code true} if the signal is cancelled, {@code false} if the timeout elapsed first
   */
  public boolean awaitCancellation(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout must not be null");
    return latch.await(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
  }

  public RetryCancelledException toException() {
    CancellationReason current = reason;
    if (current == null) {
      throw new IllegalStateException("Signal has not been cancelled");
    }
    return new RetryCancelledException(current);
  }

  /**
   * Child signal cancelled together with this one. Cancelling the child leaves this one alone and
   * detaches the child from it.
   */
  public CancellationSignal newChild() {
    CancellationSignal child = new CancellationSignal();
    Registration registration = onCancel(() -> child.cancel(reason));
    child.onCancel(registration::remove);
    return child;
  }

  /** Child signal that is additionally cancelled with {@link CancellationReason#DEADLINE_EXCEEDED}. */
  public CancellationSignal withTimeout(Duration timeout, ScheduledExecutorService scheduler) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    Objects.requireNonNull(scheduler, "scheduler must not be null");
    CancellationSignal child = newChild();
    if (child.isCancelled()) {
      return child;
    }
    ScheduledFuture<?> deadline =
        scheduler.schedule(
            () -> child.cancel(CancellationReason.DEADLINE_EXCEEDED),
            saturatedNanos(timeout),
            TimeUnit.NANOSECONDS);
    child.onCancel(() -> deadline.cancel(false));
    return child;
  }

  int listenerCount() {
    synchronized (lock) {
      return listeners.size();
    }
  }

  private void removeListener(Runnable listener) {
    synchronized (lock) {
      for (int i = 0; i < listeners.size(); i++) {
        if (listeners.get(i) == listener) {
          listeners.remove(i);
          return;
        }
      }
    }
  }

  private static long saturatedNanos(Duration duration) {
    if (duration.isNegative()) {
      return 0L;
    }
    try {
      return duration.toNanos();
    } catch (ArithmeticException overflow) {
      return Long.MAX_VALUE;
    }
  }

  @FunctionalInterface
  public interface Registration {
    void remove();
  }
}
