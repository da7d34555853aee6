package com.flamingo.ai.chartreader.service.worker;

import com.flamingo.ai.chartreader.exception.JobCancelledException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cooperative cancellation signal for one running job.
 *
 * <p>Pipeline stages call {@link #throwIfCancelled()} at their checkpoints; long remote calls
 * register a listener to abandon the call as soon as the token fires.
 */
public final class CancellationToken {

  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private volatile String reason;

  /** A token that is never cancelled, for callers outside the worker. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  public boolean isCancelled() {
    return reason != null;
  }

  public String getReason() {
    return reason;
  }

  /** Fires the token once; later calls keep the first reason. */
  public void cancel(String cancelReason) {
    synchronized (this) {
      if (reason != null) {
        return;
      }
      reason =
          cancelReason == null || cancelReason.isBlank()
              ? JobCancelledException.DEFAULT_REASON
              : cancelReason;
    }
    for (Runnable listener : listeners) {
      listener.run();
    }
  }

  /**
   * @throws JobCancelledException if the token has fired
   */
  public void throwIfCancelled() {
    String current = reason;
    if (current != null) {
      throw new JobCancelledException(current);
    }
  }

  /**
   * Registers a listener that runs when the token fires, or right away if it already has.
   *
   * @return a handle that unregisters the listener
   */
  public Runnable onCancel(Runnable listener) {
    listeners.add(listener);
    if (isCancelled()) {
      listeners.remove(listener);
      listener.run();
    }
    return () -> listeners.remove(listener);
  }
}
