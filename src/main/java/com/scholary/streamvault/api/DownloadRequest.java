package com.scholary.streamvault.api;

import com.scholary.streamvault.job.DownloadOptions;
import com.scholary.streamvault.job.MediaFormat;
import com.scholary.streamvault.job.Quality;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to download a single video.
 *
 * <p>Options are optional and default to best quality mp4 named after the title. {@code
 * scheduleAt} (ISO-8601) defers the start.
 */
public record DownloadRequest(
    @NotBlank String url,
    Quality quality,
    MediaFormat format,
    String filenameTemplate,
    String proxy,
    String scheduleAt) {

  public DownloadOptions options() {
    return new DownloadOptions(quality, format, filenameTemplate, proxy);
  }
}
