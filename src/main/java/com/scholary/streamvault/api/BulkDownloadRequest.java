package com.scholary.streamvault.api;

import com.scholary.streamvault.job.DownloadOptions;
import com.scholary.streamvault.job.MediaFormat;
import com.scholary.streamvault.job.Quality;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** Request to download several URLs with shared options. */
public record BulkDownloadRequest(
    @NotNull List<String> urls,
    Quality quality,
    MediaFormat format,
    String filenameTemplate,
    String proxy,
    String scheduleAt) {

  public DownloadOptions options() {
    return new DownloadOptions(quality, format, filenameTemplate, proxy);
  }
}
