package com.scholary.streamvault.schedule;

import com.scholary.streamvault.dispatch.DownloadDispatcher;
import com.scholary.streamvault.error.DownloadException;
import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.job.JobPatch;
import com.scholary.streamvault.job.JobStore;
import com.scholary.streamvault.job.JobStoreException;
import com.scholary.streamvault.job.ScheduleEntry;
import com.scholary.streamvault.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deferred execution of jobs.
 *
 * <p>Entries live in the job store (the source of truth) and in a min-heap ordered by fire time.
 * A periodic sweep promotes every due entry: the job goes {@code scheduled -> queued}, its entry is
 * deleted, and it is appended to the dispatch queue.
 *
 * <p>Heap entries can go stale when the job is cancelled, deleted or rescheduled through another
 * path. The sweep checks each polled entry against the store before promoting it.
 */
@Component
public class DownloadScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadScheduler.class);

  private final JobStore jobStore;
  private final DownloadDispatcher dispatcher;
  private final Clock clock;
  private final StructuredLogger structuredLogger;

  private final PriorityQueue<ScheduleEntry> heap =
      new PriorityQueue<>(Comparator.comparing(ScheduleEntry::fireAt));

  public DownloadScheduler(JobStore jobStore, DownloadDispatcher dispatcher, Clock clock) {
    this.jobStore = jobStore;
    this.dispatcher = dispatcher;
    this.clock = clock;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Create or replace the schedule of a queued or scheduled job.
   *
   * @return the job in state {@code scheduled}
   * @throws DownloadException NOT_FOUND or INVALID_STATE
   */
  public DownloadJob schedule(String jobId, Instant fireAt) {
    // The store write and the heap update must not interleave with another reschedule, or the
    // heap could keep an entry the store has already replaced.
    synchronized (heap) {
      ScheduleEntry entry = jobStore.schedule(jobId, fireAt);
      heap.removeIf(existing -> existing.jobId().equals(jobId));
      heap.add(entry);
    }
    structuredLogger.logJobScheduled(jobId, fireAt);
    return jobStore
        .get(jobId)
        .orElseThrow(() -> DownloadException.notFound("Job not found: " + jobId));
  }

  /**
   * Drop the schedule of a job and queue it now.
   *
   * @throws DownloadException NOT_FOUND, or INVALID_STATE if the job is not scheduled
   */
  public DownloadJob unschedule(String jobId) {
    DownloadJob job = jobStore.update(jobId, JobPatch.promote());
    forget(jobId);
    dispatcher.enqueue(jobId);
    LOGGER.info("Job unscheduled and queued: jobId={}", jobId);
    return job;
  }

  /** Cancel a scheduled job. */
  public DownloadJob cancel(String jobId) {
    DownloadJob job = jobStore.update(jobId, JobPatch.cancel());
    forget(jobId);
    return job;
  }

  /** Remove the in-memory entry of a job, if any. The store entry is the caller's concern. */
  public void forget(String jobId) {
    synchronized (heap) {
      heap.removeIf(entry -> entry.jobId().equals(jobId));
    }
  }

  /** Drop all in-memory entries. */
  public void clear() {
    synchronized (heap) {
      heap.clear();
    }
  }

  /** Rebuild the heap from the store after a restart. */
  public void reload() {
    List<ScheduleEntry> entries = jobStore.scheduleEntries();
    synchronized (heap) {
      heap.clear();
      heap.addAll(entries);
    }
    LOGGER.info("Loaded {} schedule entries", entries.size());
  }

  @Scheduled(
      fixedDelayString = "${downloads.scheduler.sweep-interval-ms:1000}",
      initialDelayString = "${downloads.scheduler.sweep-interval-ms:1000}")
  public void sweepDue() {
    sweep(clock.instant());
  }

  /**
   * Promote every entry due at {@code now}.
   *
   * @return ids of the promoted jobs, in fire-time order
   */
  public List<String> sweep(Instant now) {
    List<ScheduleEntry> due = new ArrayList<>();
    synchronized (heap) {
      while (!heap.isEmpty() && heap.peek().isDue(now)) {
        due.add(heap.poll());
      }
    }

    List<String> promoted = new ArrayList<>();
    for (ScheduleEntry entry : due) {
      Optional<ScheduleEntry> current = jobStore.getScheduleEntry(entry.jobId());
      if (current.isEmpty() || !current.get().fireAt().equals(entry.fireAt())) {
        LOGGER.debug("Skipping stale schedule entry for job {}", entry.jobId());
        continue;
      }
      try {
        jobStore.update(entry.jobId(), JobPatch.promote());
      } catch (JobStoreException e) {
        LOGGER.warn(
            "Could not promote job {}, retrying next sweep: {}", entry.jobId(), e.getMessage());
        synchronized (heap) {
          heap.add(entry);
        }
        continue;
      } catch (DownloadException e) {
        LOGGER.warn("Could not promote scheduled job {}: {}", entry.jobId(), e.getMessage());
        continue;
      }
      promoted.add(entry.jobId());
      structuredLogger.logSchedulePromoted(
          entry.jobId(), entry.fireAt(), Duration.between(entry.fireAt(), now).toMillis());
    }
    if (!promoted.isEmpty()) {
      dispatcher.enqueueAll(promoted);
    }
    return promoted;
  }

  /** Number of entries waiting in the heap, stale ones included. */
  public int pendingCount() {
    synchronized (heap) {
      return heap.size();
    }
  }
}
