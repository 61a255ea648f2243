package com.scholary.streamvault.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * One tracked download of a single video URL.
 *
 * <p>Immutable snapshot. The {@link JobStore} replaces the whole value on every mutation, so a
 * reader holding a reference never sees a half-applied patch.
 *
 * <p>Metadata fields ({@code title}, {@code uploader}, ...) are null until the extractor resolves
 * them. Progress fields only move while the job is downloading and keep their last value once the
 * job reaches a terminal state.
 */
public record DownloadJob(
    String id,
    String sourceUrl,
    JobState state,
    String title,
    String uploader,
    Long durationSeconds,
    String thumbnailUrl,
    Quality quality,
    MediaFormat format,
    String filenameTemplate,
    String proxy,
    double progressPercent,
    Long speedBytesPerSec,
    Long etaSeconds,
    Long fileSizeBytes,
    String localPath,
    String errorMessage,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    int retryCount,
    Instant scheduledAt,
    long sequence) {

  @JsonIgnore
  public DownloadOptions options() {
    return new DownloadOptions(quality, format, filenameTemplate, proxy);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  static Builder builder() {
    return new Builder();
  }

  /** Mutable staging area used by the store to derive the next snapshot. */
  public static final class Builder {
    private String id;
    private String sourceUrl;
    private JobState state;
    private String title;
    private String uploader;
    private Long durationSeconds;
    private String thumbnailUrl;
    private Quality quality;
    private MediaFormat format;
    private String filenameTemplate;
    private String proxy;
    private double progressPercent;
    private Long speedBytesPerSec;
    private Long etaSeconds;
    private Long fileSizeBytes;
    private String localPath;
    private String errorMessage;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private int retryCount;
    private Instant scheduledAt;
    private long sequence;

    private Builder() {}

    private Builder(DownloadJob job) {
      this.id = job.id;
      this.sourceUrl = job.sourceUrl;
      this.state = job.state;
      this.title = job.title;
      this.uploader = job.uploader;
      this.durationSeconds = job.durationSeconds;
      this.thumbnailUrl = job.thumbnailUrl;
      this.quality = job.quality;
      this.format = job.format;
      this.filenameTemplate = job.filenameTemplate;
      this.proxy = job.proxy;
      this.progressPercent = job.progressPercent;
      this.speedBytesPerSec = job.speedBytesPerSec;
      this.etaSeconds = job.etaSeconds;
      this.fileSizeBytes = job.fileSizeBytes;
      this.localPath = job.localPath;
      this.errorMessage = job.errorMessage;
      this.createdAt = job.createdAt;
      this.startedAt = job.startedAt;
      this.completedAt = job.completedAt;
      this.retryCount = job.retryCount;
      this.scheduledAt = job.scheduledAt;
      this.sequence = job.sequence;
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder sourceUrl(String sourceUrl) {
      this.sourceUrl = sourceUrl;
      return this;
    }

    public Builder state(JobState state) {
      this.state = state;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder uploader(String uploader) {
      this.uploader = uploader;
      return this;
    }

    public Builder durationSeconds(Long durationSeconds) {
      this.durationSeconds = durationSeconds;
      return this;
    }

    public Builder thumbnailUrl(String thumbnailUrl) {
      this.thumbnailUrl = thumbnailUrl;
      return this;
    }

    public Builder options(DownloadOptions options) {
      this.quality = options.quality();
      this.format = options.format();
      this.filenameTemplate = options.filenameTemplate();
      this.proxy = options.proxy();
      return this;
    }

    public Builder progressPercent(double progressPercent) {
      this.progressPercent = progressPercent;
      return this;
    }

    public Builder speedBytesPerSec(Long speedBytesPerSec) {
      this.speedBytesPerSec = speedBytesPerSec;
      return this;
    }

    public Builder etaSeconds(Long etaSeconds) {
      this.etaSeconds = etaSeconds;
      return this;
    }

    public Builder fileSizeBytes(Long fileSizeBytes) {
      this.fileSizeBytes = fileSizeBytes;
      return this;
    }

    public Builder localPath(String localPath) {
      this.localPath = localPath;
      return this;
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder startedAt(Instant startedAt) {
      this.startedAt = startedAt;
      return this;
    }

    public Builder completedAt(Instant completedAt) {
      this.completedAt = completedAt;
      return this;
    }

    public Builder retryCount(int retryCount) {
      this.retryCount = retryCount;
      return this;
    }

    public Builder scheduledAt(Instant scheduledAt) {
      this.scheduledAt = scheduledAt;
      return this;
    }

    public Builder sequence(long sequence) {
      this.sequence = sequence;
      return this;
    }

    public DownloadJob build() {
      return new DownloadJob(
          id,
          sourceUrl,
          state,
          title,
          uploader,
          durationSeconds,
          thumbnailUrl,
          quality,
          format,
          filenameTemplate,
          proxy,
          progressPercent,
          speedBytesPerSec,
          etaSeconds,
          fileSizeBytes,
          localPath,
          errorMessage,
          createdAt,
          startedAt,
          completedAt,
          retryCount,
          scheduledAt,
          sequence);
    }
  }
}
