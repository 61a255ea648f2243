package com.scholary.streamvault.stats;

/**
 * Aggregate view over the current jobs. Derived on demand, never stored.
 *
 * <p>{@code activeDownloads} counts jobs in {@code downloading}; {@code doneDownloads} counts jobs
 * in {@code completed}. The remaining per-state counters let clients render queue depth.
 */
public record StatisticsSnapshot(
    long totalDownloads,
    long activeDownloads,
    long doneDownloads,
    long totalSizeBytes,
    long averageSpeedBytesPerSec,
    long queuedDownloads,
    long scheduledDownloads,
    long failedDownloads,
    long cancelledDownloads) {

  public static StatisticsSnapshot empty() {
    return new StatisticsSnapshot(0, 0, 0, 0, 0, 0, 0, 0, 0);
  }
}
