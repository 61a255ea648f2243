package com.scholary.streamvault.job;

import com.scholary.streamvault.error.DownloadException;
import java.time.Instant;

/**
 * Partial update applied atomically by {@link JobStore#update(String, JobPatch)}.
 *
 * <p>Patches are built through intent-named factories ({@link #start()}, {@link #complete}, ...)
 * so that fields only travel with the transition that owns them: file size and path with
 * completion, the error message with failure, progress only while downloading.
 */
public final class JobPatch {

  private final JobState targetState;
  private final boolean retry;
  private final boolean durable;

  private String title;
  private String uploader;
  private Long durationSeconds;
  private String thumbnailUrl;

  private Double progressPercent;
  private Long speedBytesPerSec;
  private Long etaSeconds;

  private Long fileSizeBytes;
  private String localPath;
  private String errorMessage;

  private JobPatch(JobState targetState, boolean retry, boolean durable) {
    this.targetState = targetState;
    this.retry = retry;
    this.durable = durable;
  }

  /** queued -> downloading. */
  public static JobPatch start() {
    return new JobPatch(JobState.DOWNLOADING, false, true);
  }

  /** Live progress sample. Percent never moves backwards; not persisted. */
  public static JobPatch progress(double percent, Long speedBytesPerSec, Long etaSeconds) {
    JobPatch patch = new JobPatch(null, false, false);
    patch.progressPercent = percent;
    patch.speedBytesPerSec = speedBytesPerSec;
    patch.etaSeconds = etaSeconds;
    return patch;
  }

  /** downloading -> completed. */
  public static JobPatch complete(String localPath, long fileSizeBytes) {
    JobPatch patch = new JobPatch(JobState.COMPLETED, false, true);
    patch.localPath = localPath;
    patch.fileSizeBytes = fileSizeBytes;
    patch.progressPercent = 100.0;
    return patch;
  }

  /** downloading -> failed. */
  public static JobPatch fail(String errorMessage) {
    JobPatch patch = new JobPatch(JobState.FAILED, false, true);
    patch.errorMessage = errorMessage;
    return patch;
  }

  /** queued | scheduled | downloading -> cancelled. */
  public static JobPatch cancel() {
    return new JobPatch(JobState.CANCELLED, false, true);
  }

  /** failed -> queued, consuming one retry. */
  public static JobPatch retry() {
    return new JobPatch(JobState.QUEUED, true, true);
  }

  /** scheduled -> queued. */
  public static JobPatch promote() {
    return new JobPatch(JobState.QUEUED, false, true);
  }

  /** Metadata resolved by the extractor. Null arguments leave the field unchanged. */
  public static JobPatch metadata(
      String title, String uploader, Long durationSeconds, String thumbnailUrl) {
    JobPatch patch = new JobPatch(null, false, true);
    patch.title = title;
    patch.uploader = uploader;
    patch.durationSeconds = durationSeconds;
    patch.thumbnailUrl = thumbnailUrl;
    return patch;
  }

  public JobState targetState() {
    return targetState;
  }

  /** Whether the result must be written to the record store. */
  boolean isDurable() {
    return durable;
  }

  /**
   * Derive the next snapshot.
   *
   * @throws DownloadException with kind INVALID_STATE if the patch is not legal for {@code
   *     current}
   */
  DownloadJob applyTo(DownloadJob current, Instant now) {
    JobState from = current.state();
    DownloadJob.Builder next = current.toBuilder();

    if (targetState != null) {
      if (!from.canTransitionTo(targetState)) {
        throw DownloadException.invalidState(
            String.format(
                "Job %s cannot move from %s to %s",
                current.id(), from.wireName(), targetState.wireName()));
      }
      if (from == JobState.FAILED && !retry) {
        throw DownloadException.invalidState(
            String.format("Job %s has permanently failed", current.id()));
      }
      if (retry && from != JobState.FAILED) {
        throw DownloadException.invalidState(
            String.format(
                "Job %s is %s, only failed jobs are retried", current.id(), from.wireName()));
      }
      next.state(targetState);
    } else if (from.isTerminal()) {
      throw DownloadException.invalidState(
          String.format("Job %s is %s and can no longer change", current.id(), from.wireName()));
    }

    if (progressPercent != null && targetState == null && from != JobState.DOWNLOADING) {
      throw DownloadException.invalidState(
          String.format(
              "Job %s is %s, progress is only accepted while downloading",
              current.id(), from.wireName()));
    }

    if (title != null) {
      next.title(title);
    }
    if (uploader != null) {
      next.uploader(uploader);
    }
    if (durationSeconds != null) {
      next.durationSeconds(durationSeconds);
    }
    if (thumbnailUrl != null) {
      next.thumbnailUrl(thumbnailUrl);
    }

    if (progressPercent != null) {
      double clamped = Math.max(0.0, Math.min(100.0, progressPercent));
      next.progressPercent(Math.max(current.progressPercent(), clamped));
    }
    if (targetState == null && progressPercent != null) {
      next.speedBytesPerSec(speedBytesPerSec);
      next.etaSeconds(etaSeconds);
    }

    if (targetState == JobState.DOWNLOADING) {
      next.startedAt(now).progressPercent(0.0).speedBytesPerSec(null).etaSeconds(null);
    }
    if (targetState == JobState.COMPLETED) {
      next.localPath(localPath).fileSizeBytes(fileSizeBytes);
    }
    if (targetState == JobState.FAILED) {
      next.errorMessage(errorMessage);
    }
    if (targetState != null && targetState.isTerminal()) {
      next.completedAt(now);
    }
    if (targetState == JobState.QUEUED) {
      next.scheduledAt(null);
    }
    if (retry) {
      next.retryCount(current.retryCount() + 1)
          .errorMessage(null)
          .progressPercent(0.0)
          .speedBytesPerSec(null)
          .etaSeconds(null)
          .startedAt(null)
          .completedAt(null);
    }
    if (targetState == JobState.CANCELLED) {
      next.scheduledAt(null);
    }
    return next.build();
  }
}
