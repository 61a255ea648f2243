package com.scholary.streamvault.api;

import com.scholary.streamvault.job.DownloadJob;
import java.util.List;

/**
 * Response for submissions.
 *
 * <p>Lists the jobs created, in submission order. Duplicate URLs in a bulk request produce a
 * single job, so {@code count} can be lower than the number of URLs sent.
 */
public record SubmitResponse(int count, List<DownloadJob> jobs) {

  public static SubmitResponse of(List<DownloadJob> jobs) {
    return new SubmitResponse(jobs.size(), jobs);
  }
}
