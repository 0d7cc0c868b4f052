package com.verlumen.paramsweep.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a running sweep. Checked before each dispatch; evaluations
 * already running are allowed to finish.
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public static CancellationToken create() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  private CancellationToken() {}
}
