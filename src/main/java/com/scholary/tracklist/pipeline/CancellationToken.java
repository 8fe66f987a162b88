package com.scholary.tracklist.pipeline;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a pipeline run, optionally with a deadline.
 *
 * <p>Cancelling stops new segments from being started. Work already in flight finishes.
 */
public final class CancellationToken {

  private static final long NO_DEADLINE = Long.MAX_VALUE;

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final long deadlineNanos;

  private CancellationToken(long deadlineNanos) {
    this.deadlineNanos = deadlineNanos;
  }

  public static CancellationToken create() {
    return new CancellationToken(NO_DEADLINE);
  }

  /** A token that cancels itself once {@code budget} has elapsed from now. */
  public static CancellationToken withBudget(Duration budget) {
    if (budget == null) {
      return create();
    }
    return new CancellationToken(System.nanoTime() + budget.toNanos());
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    if (cancelled.get()) {
      return true;
    }
    if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
      cancelled.set(true);
      return true;
    }
    return false;
  }
}
