package com.scholary.streamvault.notify;

import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.stats.StatisticsSnapshot;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload pushed to live-update observers.
 *
 * @param type always {@code stats_update}
 * @param stats aggregate counters at the time of the push
 * @param activeDownloads non-terminal jobs keyed by id, in submission order
 */
public record StatsUpdateMessage(
    String type, StatisticsSnapshot stats, Map<String, DownloadJob> activeDownloads) {

  public static final String TYPE = "stats_update";

  public StatsUpdateMessage {
    activeDownloads = Collections.unmodifiableMap(new LinkedHashMap<>(activeDownloads));
  }

  public static StatsUpdateMessage of(
      StatisticsSnapshot stats, Map<String, DownloadJob> activeDownloads) {
    return new StatsUpdateMessage(TYPE, stats, activeDownloads);
  }
}
