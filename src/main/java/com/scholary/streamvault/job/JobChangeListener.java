package com.scholary.streamvault.job;

/**
 * Callback for committed store mutations.
 *
 * <p>Invoked on the mutating thread after the store lock is released. Implementations must not
 * block.
 */
@FunctionalInterface
public interface JobChangeListener {

  void onJobChanged(JobChange change);
}
