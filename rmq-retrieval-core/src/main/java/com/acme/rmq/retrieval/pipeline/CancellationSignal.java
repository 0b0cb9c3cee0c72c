package com.acme.rmq.retrieval.pipeline;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot cancellation latch owned by the caller of a retrieval run, typically fired by an
 * operator interrupt. A caller wanting a timeout cancels it after the deadline.
 */
public final class CancellationSignal {
  private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

  private final List<Runnable> listeners = new ArrayList<>();
  private volatile boolean cancelled;

  /**
   * Fires the signal and runs the registered listeners on the calling thread.
   *
   * @return {@code true} if this call fired the signal, {@code false} if it was already fired
   */
  public boolean cancel() {
    List<Runnable> toRun;
    synchronized (this) {
      if (cancelled) {
        return false;
      }
      cancelled = true;
      toRun = new ArrayList<>(listeners);
      listeners.clear();
    }
    for (Runnable listener : toRun) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        log.warn("Cancellation listener failed", e);
      }
    }
    return true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /** Registers a listener; runs it immediately when the signal has already fired. */
  public void onCancel(Runnable listener) {
    synchronized (this) {
      if (!cancelled) {
        listeners.add(listener);
        return;
      }
    }
    listener.run();
  }
}
