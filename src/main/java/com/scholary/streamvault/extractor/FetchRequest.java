package com.scholary.streamvault.extractor;

import com.scholary.streamvault.job.DownloadOptions;

/**
 * Input of {@link Extractor#fetch}.
 *
 * @param jobId owning job, used to name the private working directory
 * @param url source URL
 * @param options quality, format, filename template and proxy
 */
public record FetchRequest(String jobId, String url, DownloadOptions options) {}
