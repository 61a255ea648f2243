package com.scholary.streamvault.job;

/**
 * Creation request for a single job.
 *
 * <p>Metadata is optional: playlist expansion already knows titles and durations, a single submit
 * does not and leaves them for the asynchronous probe.
 */
public record JobSpec(
    String sourceUrl,
    DownloadOptions options,
    String title,
    String uploader,
    Long durationSeconds,
    String thumbnailUrl) {

  public JobSpec {
    if (options == null) {
      options = DownloadOptions.defaults();
    }
  }

  public static JobSpec of(String sourceUrl, DownloadOptions options) {
    return new JobSpec(sourceUrl, options, null, null, null, null);
  }
}
