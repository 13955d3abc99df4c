package com.paysync.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop flag shared between the control surface and one run. The run polls it
 * between page fetches and between item fetches only.
 */
public final class CancellationToken {
  private final AtomicBoolean requested = new AtomicBoolean();

  public void cancel() {
    requested.set(true);
  }

  public boolean isCancellationRequested() {
    return requested.get();
  }
}
