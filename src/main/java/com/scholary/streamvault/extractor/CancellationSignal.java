package com.scholary.streamvault.extractor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot cancellation flag shared between the dispatcher and a running fetch.
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run once, on the cancelling thread. A
 * callback registered after cancellation runs immediately.
 */
public final class CancellationSignal {

  private static final Logger LOGGER = LoggerFactory.getLogger(CancellationSignal.class);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** @return true if this call flipped the flag */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    for (Runnable callback : callbacks) {
      if (callbacks.remove(callback)) {
        runSafely(callback);
      }
    }
    return true;
  }

  public void onCancel(Runnable callback) {
    callbacks.add(callback);
    if (cancelled.get() && callbacks.remove(callback)) {
      runSafely(callback);
    }
  }

  private static void runSafely(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      LOGGER.warn("Cancellation callback failed", e);
    }
  }
}
