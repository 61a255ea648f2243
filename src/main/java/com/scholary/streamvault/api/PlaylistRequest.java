package com.scholary.streamvault.api;

import com.scholary.streamvault.job.DownloadOptions;
import com.scholary.streamvault.job.MediaFormat;
import com.scholary.streamvault.job.Quality;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request to download a playlist or channel.
 *
 * <p>{@code maxVideos} caps the number of entries; the server applies its own upper bound too.
 */
public record PlaylistRequest(
    @NotBlank String url,
    @Positive Integer maxVideos,
    Quality quality,
    MediaFormat format,
    String filenameTemplate,
    String proxy,
    String scheduleAt) {

  public DownloadOptions options() {
    return new DownloadOptions(quality, format, filenameTemplate, proxy);
  }
}
