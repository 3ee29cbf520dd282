package com.streamfirst.mosaic.application;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation signal checked by long-running tasks at safe points. A token is
 * cancelled either explicitly or as soon as its condition holds.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final BooleanSupplier condition;

  private CancellationToken(BooleanSupplier condition) {
    this.condition = condition;
  }

  /** A token that is only ever cancelled explicitly. */
  public static CancellationToken create() {
    return new CancellationToken(() -> false);
  }

  /** A token that also counts as cancelled whenever {@code condition} returns true. */
  public static CancellationToken when(BooleanSupplier condition) {
    return new CancellationToken(condition);
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get() || condition.getAsBoolean();
  }
}
