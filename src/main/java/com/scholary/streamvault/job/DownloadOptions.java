package com.scholary.streamvault.job;

/**
 * User-chosen options attached to a job at creation. Immutable for the job's lifetime.
 *
 * @param quality requested quality cap
 * @param format output container
 * @param filenameTemplate extractor output template, relative to the download directory
 * @param proxy optional proxy URL handed to the extractor
 */
public record DownloadOptions(
    Quality quality, MediaFormat format, String filenameTemplate, String proxy) {

  public static final String DEFAULT_FILENAME_TEMPLATE = "%(title)s.%(ext)s";

  // Provide defaults
  public DownloadOptions {
    if (quality == null) {
      quality = Quality.BEST;
    }
    if (format == null) {
      format = MediaFormat.MP4;
    }
    if (filenameTemplate == null || filenameTemplate.isBlank()) {
      filenameTemplate = DEFAULT_FILENAME_TEMPLATE;
    }
    if (proxy != null && proxy.isBlank()) {
      proxy = null;
    }
  }

  public static DownloadOptions defaults() {
    return new DownloadOptions(null, null, null, null);
  }
}
