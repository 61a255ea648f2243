package com.scholary.streamvault.notify;

/** A connected consumer of live updates. */
public interface UpdateObserver {

  /** Stable id, used for logging and removal. */
  String id();

  /**
   * Hand a message to the observer without waiting for delivery.
   *
   * @return false if the observer cannot take it (buffer full or connection gone); the broadcaster
   *     then drops the observer
   */
  boolean offer(StatsUpdateMessage message);
}
