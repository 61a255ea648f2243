package com.scholary.streamvault.job;

import com.scholary.streamvault.error.DownloadException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-writer store for jobs and their schedule entries.
 *
 * <p>All mutation of job records passes through this class. Each operation runs under one write
 * lock: the next snapshot is derived, written through to the {@link RecordStore} and only then
 * published to the in-memory view. Readers take the read lock and always see complete snapshots.
 *
 * <p>A job leaving {@code scheduled} loses its schedule entry inside the same critical section,
 * which keeps "at most one entry, and only for scheduled jobs" true at every observable point.
 *
 * <p>Listeners are notified after the lock is released, in commit order per calling thread.
 */
public class JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStore.class);

  private final RecordStore<DownloadJob> jobRecords;
  private final RecordStore<ScheduleEntry> scheduleRecords;
  private final Clock clock;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, DownloadJob> jobs = new HashMap<>();
  private final Map<String, ScheduleEntry> schedules = new HashMap<>();
  private final List<JobChangeListener> listeners = new CopyOnWriteArrayList<>();

  private long nextSequence;

  public JobStore(
      RecordStore<DownloadJob> jobRecords,
      RecordStore<ScheduleEntry> scheduleRecords,
      Clock clock) {
    this.jobRecords = jobRecords;
    this.scheduleRecords = scheduleRecords;
    this.clock = clock;
    recover();
  }

  public void addListener(JobChangeListener listener) {
    listeners.add(listener);
  }

  /** Insert one job in state {@code queued}. */
  public DownloadJob create(JobSpec spec) {
    return createAll(List.of(spec)).get(0);
  }

  /**
   * Insert several jobs in one write, preserving the order of {@code specs} in their sequence
   * numbers.
   */
  public List<DownloadJob> createAll(List<JobSpec> specs) {
    if (specs.isEmpty()) {
      return List.of();
    }
    List<DownloadJob> created = new ArrayList<>(specs.size());
    lock.writeLock().lock();
    try {
      Instant now = clock.instant();
      long sequence = nextSequence;
      Map<String, DownloadJob> batch = new LinkedHashMap<>();
      for (JobSpec spec : specs) {
        DownloadJob job =
            DownloadJob.builder()
                .id(UUID.randomUUID().toString())
                .sourceUrl(spec.sourceUrl())
                .state(JobState.QUEUED)
                .title(spec.title())
                .uploader(spec.uploader())
                .durationSeconds(spec.durationSeconds())
                .thumbnailUrl(spec.thumbnailUrl())
                .options(spec.options())
                .createdAt(now)
                .sequence(sequence++)
                .build();
        batch.put(job.id(), job);
        created.add(job);
      }
      jobRecords.saveAll(batch);
      jobs.putAll(batch);
      nextSequence = sequence;
    } finally {
      lock.writeLock().unlock();
    }
    created.forEach(job -> notifyListeners(new JobChange(null, job)));
    return created;
  }

  /**
   * Apply a patch atomically.
   *
   * @return the committed snapshot
   * @throws DownloadException NOT_FOUND for unknown ids, INVALID_STATE for illegal patches
   * @throws JobStoreException if persisting fails; the job keeps its previous value
   */
  public DownloadJob update(String id, JobPatch patch) {
    DownloadJob previous;
    DownloadJob next;
    lock.writeLock().lock();
    try {
      previous = requireJob(id);
      next = patch.applyTo(previous, clock.instant());
      if (patch.isDurable()) {
        jobRecords.save(id, next);
      }
      if (next.state() != JobState.SCHEDULED && schedules.containsKey(id)) {
        scheduleRecords.delete(id);
        schedules.remove(id);
      }
      jobs.put(id, next);
    } finally {
      lock.writeLock().unlock();
    }
    notifyListeners(new JobChange(previous, next));
    return next;
  }

  /**
   * Create or replace the schedule entry of a queued or scheduled job and move it to {@code
   * scheduled}.
   *
   * @throws DownloadException NOT_FOUND or INVALID_STATE
   */
  public ScheduleEntry schedule(String id, Instant fireAt) {
    DownloadJob previous;
    DownloadJob next;
    ScheduleEntry entry;
    lock.writeLock().lock();
    try {
      previous = requireJob(id);
      if (previous.state() != JobState.QUEUED && previous.state() != JobState.SCHEDULED) {
        throw DownloadException.invalidState(
            String.format(
                "Job %s is %s, only queued or scheduled jobs can be scheduled",
                id, previous.state().wireName()));
      }
      entry = new ScheduleEntry(id, fireAt, clock.instant());
      next = previous.toBuilder().state(JobState.SCHEDULED).scheduledAt(fireAt).build();
      scheduleRecords.save(id, entry);
      try {
        jobRecords.save(id, next);
      } catch (JobStoreException e) {
        rollbackSchedule(id);
        throw e;
      }
      schedules.put(id, entry);
      jobs.put(id, next);
    } finally {
      lock.writeLock().unlock();
    }
    notifyListeners(new JobChange(previous, next));
    return entry;
  }

  public Optional<DownloadJob> get(String id) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(jobs.get(id));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** All jobs in submission order. */
  public List<DownloadJob> list() {
    return list(job -> true);
  }

  /** Jobs matching {@code filter}, in submission order. */
  public List<DownloadJob> list(Predicate<DownloadJob> filter) {
    lock.readLock().lock();
    try {
      return jobs.values().stream()
          .filter(filter)
          .sorted(Comparator.comparingLong(DownloadJob::sequence))
          .collect(Collectors.toList());
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<ScheduleEntry> getScheduleEntry(String id) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(schedules.get(id));
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<ScheduleEntry> scheduleEntries() {
    lock.readLock().lock();
    try {
      return schedules.values().stream()
          .sorted(Comparator.comparing(ScheduleEntry::fireAt))
          .collect(Collectors.toList());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Remove a job and its schedule entry. Callers must cancel downloading jobs first.
   *
   * @return the removed job, empty if unknown
   */
  public Optional<DownloadJob> delete(String id) {
    DownloadJob removed;
    lock.writeLock().lock();
    try {
      removed = jobs.get(id);
      if (removed == null) {
        return Optional.empty();
      }
      if (schedules.containsKey(id)) {
        scheduleRecords.delete(id);
        schedules.remove(id);
      }
      jobRecords.delete(id);
      jobs.remove(id);
    } finally {
      lock.writeLock().unlock();
    }
    notifyListeners(new JobChange(removed, null));
    return Optional.of(removed);
  }

  /**
   * Remove every job and schedule entry. Callers must cancel downloading jobs first.
   *
   * @return the removed jobs in submission order
   */
  public List<DownloadJob> clear() {
    List<DownloadJob> removed;
    lock.writeLock().lock();
    try {
      removed =
          jobs.values().stream()
              .sorted(Comparator.comparingLong(DownloadJob::sequence))
              .collect(Collectors.toList());
      scheduleRecords.clear();
      jobRecords.clear();
      schedules.clear();
      jobs.clear();
    } finally {
      lock.writeLock().unlock();
    }
    removed.forEach(job -> notifyListeners(new JobChange(job, null)));
    return removed;
  }

  private DownloadJob requireJob(String id) {
    DownloadJob job = jobs.get(id);
    if (job == null) {
      throw DownloadException.notFound("Job not found: " + id);
    }
    return job;
  }

  private void rollbackSchedule(String id) {
    ScheduleEntry before = schedules.get(id);
    try {
      if (before != null) {
        scheduleRecords.save(id, before);
      } else {
        scheduleRecords.delete(id);
      }
    } catch (JobStoreException e) {
      LOGGER.error("Failed to roll back schedule entry for job {}", id, e);
    }
  }

  private void notifyListeners(JobChange change) {
    for (JobChangeListener listener : listeners) {
      try {
        listener.onJobChanged(change);
      } catch (RuntimeException e) {
        LOGGER.warn("Job change listener failed for job {}", change.jobId(), e);
      }
    }
  }

  /**
   * Rebuild the in-memory view from the record store after a restart.
   *
   * <p>A job persisted as {@code downloading} was interrupted mid-fetch and goes back to {@code
   * queued}. Schedule entries are only kept for jobs that are still scheduled; scheduled jobs
   * that lost their entry are queued.
   */
  private void recover() {
    Map<String, DownloadJob> loadedJobs = jobRecords.loadAll();
    Map<String, ScheduleEntry> loadedSchedules = scheduleRecords.loadAll();
    Map<String, DownloadJob> repaired = new LinkedHashMap<>();
    long maxSequence = -1;

    for (DownloadJob job : loadedJobs.values()) {
      maxSequence = Math.max(maxSequence, job.sequence());
      DownloadJob recovered = job;
      if (job.state() == JobState.DOWNLOADING) {
        recovered =
            job.toBuilder()
                .state(JobState.QUEUED)
                .progressPercent(0.0)
                .speedBytesPerSec(null)
                .etaSeconds(null)
                .startedAt(null)
                .build();
      } else if (job.state() == JobState.SCHEDULED && !loadedSchedules.containsKey(job.id())) {
        recovered = job.toBuilder().state(JobState.QUEUED).scheduledAt(null).build();
      }
      if (recovered != job) {
        repaired.put(job.id(), recovered);
      }
      jobs.put(job.id(), recovered);
    }

    for (ScheduleEntry entry : loadedSchedules.values()) {
      DownloadJob job = jobs.get(entry.jobId());
      if (job != null && job.state() == JobState.SCHEDULED) {
        schedules.put(entry.jobId(), entry);
      } else {
        scheduleRecords.delete(entry.jobId());
      }
    }
    if (!repaired.isEmpty()) {
      jobRecords.saveAll(repaired);
      LOGGER.info("Re-queued {} jobs interrupted by the previous shutdown", repaired.size());
    }
    nextSequence = maxSequence + 1;
    LOGGER.info("Job store ready: jobs={}, scheduleEntries={}", jobs.size(), schedules.size());
  }
}
