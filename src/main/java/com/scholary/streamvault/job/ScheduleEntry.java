package com.scholary.streamvault.job;

import java.time.Instant;

/**
 * Deferred-execution binding: the job becomes queued once {@code fireAt} has passed.
 *
 * <p>A job has at most one entry. Replacing the fire time replaces the entry.
 */
public record ScheduleEntry(String jobId, Instant fireAt, Instant createdAt) {

  public boolean isDue(Instant now) {
    return !fireAt.isAfter(now);
  }
}
