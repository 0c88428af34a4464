/*
 * Where: Notification engine domain model
 * What: Cooperative cancellation flag shared between a worker and the processor
 * Why: Shutdown must stop a long recipient scan without leaving partial writes
 */
package com.example.docnotify.engine.model;

import java.util.concurrent.atomic.AtomicBoolean;

public final class ProcessingContext {

  private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);

  public void requestCancellation() {
    cancellationRequested.set(true);
  }

  public boolean isCancellationRequested() {
    return cancellationRequested.get();
  }
}
