package com.flamingo.ai.formfill.service.execute;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation flag, checked by the executor between fields. */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
