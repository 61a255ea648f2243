package com.scholary.streamvault.stats;

import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.job.JobStore;
import java.util.Collection;
import org.springframework.stereotype.Component;

/**
 * Computes {@link StatisticsSnapshot}s from the job store.
 *
 * <p>Jobs carry their own live progress, so a single pass over one consistent listing is enough
 * and the counters can never drift from a recount.
 */
@Component
public class StatisticsAggregator {

  private final JobStore jobStore;

  public StatisticsAggregator(JobStore jobStore) {
    this.jobStore = jobStore;
  }

  public StatisticsSnapshot snapshot() {
    return aggregate(jobStore.list());
  }

  /** Pure aggregation over an explicit job collection. */
  public static StatisticsSnapshot aggregate(Collection<DownloadJob> jobs) {
    long queued = 0;
    long scheduled = 0;
    long downloading = 0;
    long completed = 0;
    long failed = 0;
    long cancelled = 0;
    long totalSize = 0;
    long speedSum = 0;

    for (DownloadJob job : jobs) {
      switch (job.state()) {
        case QUEUED -> queued++;
        case SCHEDULED -> scheduled++;
        case DOWNLOADING -> {
          downloading++;
          if (job.speedBytesPerSec() != null) {
            speedSum += job.speedBytesPerSec();
          }
        }
        case COMPLETED -> {
          completed++;
          if (job.fileSizeBytes() != null) {
            totalSize += job.fileSizeBytes();
          }
        }
        case FAILED -> failed++;
        case CANCELLED -> cancelled++;
        default -> throw new IllegalStateException("Unknown state: " + job.state());
      }
    }

    long averageSpeed = downloading == 0 ? 0 : speedSum / downloading;
    return new StatisticsSnapshot(
        jobs.size(),
        downloading,
        completed,
        totalSize,
        averageSpeed,
        queued,
        scheduled,
        failed,
        cancelled);
  }
}
