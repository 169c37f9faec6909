package org.auditfile.ingest.progress;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag. May be set from any thread; a running ingest notices it at its
 * next progress tick.
 */
public class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
