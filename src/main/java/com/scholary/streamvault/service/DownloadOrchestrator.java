package com.scholary.streamvault.service;

import com.scholary.streamvault.config.DownloadProperties;
import com.scholary.streamvault.dispatch.DownloadDispatcher;
import com.scholary.streamvault.error.DownloadException;
import com.scholary.streamvault.error.ErrorKind;
import com.scholary.streamvault.extractor.Extractor;
import com.scholary.streamvault.extractor.MediaProbe;
import com.scholary.streamvault.extractor.PlaylistAnalysis;
import com.scholary.streamvault.extractor.PlaylistEntry;
import com.scholary.streamvault.extractor.VideoMetadata;
import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.job.DownloadOptions;
import com.scholary.streamvault.job.JobPatch;
import com.scholary.streamvault.job.JobSpec;
import com.scholary.streamvault.job.JobState;
import com.scholary.streamvault.job.JobStore;
import com.scholary.streamvault.logging.StructuredLogger;
import com.scholary.streamvault.schedule.DownloadScheduler;
import com.scholary.streamvault.stats.StatisticsAggregator;
import com.scholary.streamvault.stats.StatisticsSnapshot;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Entry point for every download operation.
 *
 * <p>Validates input, expands submissions into jobs and routes them to the dispatcher (now) or
 * the scheduler (later). Reads go straight to the job store. Every mutation of a job happens in
 * the store; this class only issues intents against it.
 */
@Service
public class DownloadOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final DownloadDispatcher dispatcher;
  private final DownloadScheduler scheduler;
  private final Extractor extractor;
  private final StatisticsAggregator statisticsAggregator;
  private final Executor metadataExecutor;
  private final Clock clock;
  private final SubmissionValidator validator;

  private final int maxConcurrencyLimit;
  private final int playlistMaxVideos;
  private final long cancelGraceSeconds;

  public DownloadOrchestrator(
      JobStore jobStore,
      DownloadDispatcher dispatcher,
      DownloadScheduler scheduler,
      Extractor extractor,
      StatisticsAggregator statisticsAggregator,
      @Qualifier("metadataExecutor") Executor metadataExecutor,
      Clock clock,
      DownloadProperties properties) {
    this.jobStore = jobStore;
    this.dispatcher = dispatcher;
    this.scheduler = scheduler;
    this.extractor = extractor;
    this.statisticsAggregator = statisticsAggregator;
    this.metadataExecutor = metadataExecutor;
    this.clock = clock;
    this.validator = new SubmissionValidator(properties.allowedHosts());
    this.maxConcurrencyLimit = properties.maxConcurrencyLimit();
    this.playlistMaxVideos = properties.playlist().maxVideos();
    this.cancelGraceSeconds = properties.cancelGraceSeconds();
  }

  /** Re-enqueue queued jobs and reload schedule entries left by the previous run. */
  @EventListener(ApplicationReadyEvent.class)
  public void recover() {
    List<String> queued =
        jobStore.list(job -> job.state() == JobState.QUEUED).stream()
            .map(DownloadJob::id)
            .collect(Collectors.toList());
    scheduler.reload();
    dispatcher.enqueueAll(queued);
    LOGGER.info("Recovered {} queued jobs", queued.size());
  }

  /**
   * Submit one URL.
   *
   * @param scheduleAt optional ISO-8601 fire time; null starts the job as soon as a slot frees
   * @throws DownloadException INVALID_URL, INVALID_REQUEST or INVALID_TIME; nothing is created
   */
  public DownloadJob submitSingle(String url, DownloadOptions options, String scheduleAt) {
    String normalized = validator.validateUrl(url);
    DownloadOptions resolved = resolveOptions(options);
    Instant fireAt = parseOptionalFireTime(scheduleAt);

    DownloadJob job =
        submit(List.of(JobSpec.of(normalized, resolved)), fireAt, "single", 1).get(0);
    probeMetadataAsync(job);
    return job;
  }

  /**
   * Submit several URLs at once.
   *
   * <p>All URLs are validated before any job is created. Duplicates (after trimming) are
   * submitted once, in order of first appearance.
   *
   * @return the created jobs in input order; empty for an empty list
   */
  public List<DownloadJob> submitBulk(
      List<String> urls, DownloadOptions options, String scheduleAt) {
    if (urls == null || urls.isEmpty()) {
      return List.of();
    }
    Set<String> unique = new LinkedHashSet<>();
    for (int i = 0; i < urls.size(); i++) {
      try {
        unique.add(validator.validateUrl(urls.get(i)));
      } catch (DownloadException e) {
        throw new DownloadException(
            e.getKind(), "URL #" + (i + 1) + " is invalid: " + e.getMessage());
      }
    }
    DownloadOptions resolved = resolveOptions(options);
    Instant fireAt = parseOptionalFireTime(scheduleAt);

    List<JobSpec> specs =
        unique.stream().map(url -> JobSpec.of(url, resolved)).collect(Collectors.toList());
    List<DownloadJob> jobs = submit(specs, fireAt, "bulk", urls.size());
    jobs.forEach(this::probeMetadataAsync);
    return jobs;
  }

  /**
   * Probe a URL without creating anything.
   *
   * @throws DownloadException INVALID_URL, NOT_FOUND, UNSUPPORTED or EXTRACT_ERROR
   */
  public MediaProbe analyze(String url) {
    return extractor.probe(validator.validateUrl(url));
  }

  /**
   * Probe a playlist or channel URL.
   *
   * @throws DownloadException UNSUPPORTED when the URL is a single video
   */
  public PlaylistAnalysis analyzePlaylist(String url) {
    MediaProbe probe = analyze(url);
    if (probe.type() != MediaProbe.Type.PLAYLIST) {
      throw new DownloadException(ErrorKind.UNSUPPORTED, "URL is a single video, not a playlist");
    }
    return probe.playlist();
  }

  /**
   * Expand a playlist into jobs, in playlist order, with metadata taken from the entries.
   *
   * @param maxVideos requested cap; null means the configured maximum
   */
  public List<DownloadJob> submitPlaylist(
      String url, DownloadOptions options, Integer maxVideos, String scheduleAt) {
    if (maxVideos != null && maxVideos < 1) {
      throw DownloadException.invalidRequest("max_videos must be at least 1");
    }
    DownloadOptions resolved = resolveOptions(options);
    Instant fireAt = parseOptionalFireTime(scheduleAt);
    PlaylistAnalysis playlist = analyzePlaylist(url);

    int limit = Math.min(maxVideos == null ? playlistMaxVideos : maxVideos, playlistMaxVideos);
    List<JobSpec> specs = new ArrayList<>();
    for (PlaylistEntry entry : playlist.entries()) {
      if (specs.size() >= limit) {
        break;
      }
      specs.add(
          new JobSpec(
              entry.url(),
              resolved,
              entry.title(),
              entry.uploader(),
              entry.durationSeconds(),
              entry.thumbnailUrl()));
    }
    LOGGER.info(
        "Expanding playlist '{}': entries={}, limit={}, submitting={}",
        playlist.title(),
        playlist.entries().size(),
        limit,
        specs.size());
    return submit(specs, fireAt, "playlist", playlist.entries().size());
  }

  /**
   * Schedule or reschedule a job.
   *
   * @param fireTime ISO-8601 instant in the future
   * @throws DownloadException NOT_FOUND, INVALID_TIME or INVALID_STATE
   */
  public DownloadJob schedule(String jobId, String fireTime) {
    requireJob(jobId);
    return schedule(jobId, validator.parseFireTime(fireTime));
  }

  public DownloadJob schedule(String jobId, Instant fireAt) {
    requireJob(jobId);
    requireFuture(fireAt);
    return scheduler.schedule(jobId, fireAt);
  }

  /** Return a scheduled job to the back of the queue. */
  public DownloadJob unschedule(String jobId) {
    requireJob(jobId);
    return scheduler.unschedule(jobId);
  }

  /**
   * Cancel a job. Queued and scheduled jobs are cancelled immediately, downloading jobs once the
   * fetch has stopped.
   *
   * @return the job as it is now
   * @throws DownloadException NOT_FOUND, or INVALID_STATE for finished jobs
   */
  public DownloadJob cancelJob(String jobId) {
    DownloadJob job = requireJob(jobId);
    switch (job.state()) {
      case SCHEDULED -> scheduler.cancel(jobId);
      case QUEUED, DOWNLOADING -> dispatcher.cancel(jobId);
      default -> throw DownloadException.invalidState(
          "Job " + jobId + " is already " + job.state().wireName());
    }
    return jobStore.get(jobId).orElse(job);
  }

  /** All jobs, newest first. */
  public List<DownloadJob> listJobs() {
    List<DownloadJob> jobs = new ArrayList<>(jobStore.list());
    Collections.reverse(jobs);
    return jobs;
  }

  public DownloadJob getJob(String jobId) {
    return requireJob(jobId);
  }

  public StatisticsSnapshot getStatistics() {
    return statisticsAggregator.snapshot();
  }

  /**
   * Path of a completed job's file.
   *
   * @throws DownloadException NOT_FOUND if the job is unknown, not completed or the file is gone
   */
  public Path resolveFile(String jobId) {
    DownloadJob job = requireJob(jobId);
    if (job.state() != JobState.COMPLETED || job.localPath() == null) {
      throw DownloadException.notFound("File not available for job " + jobId);
    }
    Path path = Paths.get(job.localPath());
    if (!Files.isRegularFile(path)) {
      throw DownloadException.notFound("File no longer exists for job " + jobId);
    }
    return path;
  }

  /**
   * Delete a job. The dispatcher holds it while a running fetch is cancelled (waiting at most the
   * grace period), so it cannot start or restart before the record is gone. The file of a
   * completed job is removed with it.
   */
  public void deleteJob(String jobId) {
    DownloadJob job = requireJob(jobId);
    List<String> ids = List.of(jobId);
    DownloadJob removed;
    try {
      awaitCancellation(dispatcher.hold(ids));
      removed = jobStore.delete(jobId).orElse(job);
      scheduler.forget(jobId);
    } finally {
      dispatcher.release(ids);
    }

    if (removed.state() == JobState.COMPLETED && removed.localPath() != null) {
      try {
        Files.deleteIfExists(Paths.get(removed.localPath()));
      } catch (IOException e) {
        LOGGER.warn("Could not delete file of job {}: {}", jobId, e.getMessage());
      }
    }
    LOGGER.info("Deleted job {} ({})", jobId, removed.state().wireName());
  }

  /**
   * Cancel active work and forget every job and schedule entry. Dispatch is held for the whole
   * clear, so no queued job starts in between. Downloaded files stay on disk.
   *
   * @return number of jobs removed
   */
  public int clearHistory() {
    List<DownloadJob> removed;
    try {
      awaitCancellation(dispatcher.holdAll());
      removed = jobStore.clear();
      scheduler.clear();
    } finally {
      dispatcher.releaseAll();
    }
    LOGGER.info("History cleared: {} jobs removed", removed.size());
    return removed.size();
  }

  public int getMaxDownloads() {
    return dispatcher.getMaxDownloads();
  }

  /**
   * @throws DownloadException INVALID_REQUEST outside 1..max-concurrency-limit
   */
  public int setMaxDownloads(int maxDownloads) {
    if (maxDownloads < 1 || maxDownloads > maxConcurrencyLimit) {
      throw DownloadException.invalidRequest(
          "max_downloads must be between 1 and " + maxConcurrencyLimit);
    }
    dispatcher.setMaxDownloads(maxDownloads);
    return maxDownloads;
  }

  private List<DownloadJob> submit(
      List<JobSpec> specs, Instant fireAt, String source, int requested) {
    List<DownloadJob> created = jobStore.createAll(specs);
    structuredLogger.logJobsSubmitted(source, requested, created.size());
    if (created.isEmpty()) {
      return created;
    }
    if (fireAt == null) {
      dispatcher.enqueueAll(created.stream().map(DownloadJob::id).collect(Collectors.toList()));
      return created;
    }
    List<DownloadJob> scheduled = new ArrayList<>(created.size());
    for (DownloadJob job : created) {
      scheduled.add(scheduler.schedule(job.id(), fireAt));
    }
    return scheduled;
  }

  private DownloadOptions resolveOptions(DownloadOptions options) {
    DownloadOptions resolved = options == null ? DownloadOptions.defaults() : options;
    validator.validateOptions(resolved);
    return resolved;
  }

  private Instant parseOptionalFireTime(String scheduleAt) {
    if (scheduleAt == null || scheduleAt.isBlank()) {
      return null;
    }
    Instant fireAt = validator.parseFireTime(scheduleAt);
    requireFuture(fireAt);
    return fireAt;
  }

  private void requireFuture(Instant fireAt) {
    if (fireAt == null) {
      throw DownloadException.invalidTime("Fire time is required");
    }
    if (!fireAt.isAfter(clock.instant())) {
      throw DownloadException.invalidTime("Fire time is in the past: " + fireAt);
    }
  }

  private DownloadJob requireJob(String jobId) {
    return jobStore
        .get(jobId)
        .orElseThrow(() -> DownloadException.notFound("Job not found: " + jobId));
  }

  private void awaitCancellation(CompletableFuture<Void> stopped) {
    try {
      stopped.get(cancelGraceSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      LOGGER.warn(
          "Downloads did not stop within {}s, removing them anyway", cancelGraceSeconds);
    } catch (ExecutionException e) {
      LOGGER.warn("Cancellation failed: {}", e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DownloadException(ErrorKind.CANCELLED, "Interrupted while cancelling", e);
    }
  }

  private void probeMetadataAsync(DownloadJob job) {
    try {
      metadataExecutor.execute(() -> probeMetadata(job));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Metadata probe rejected for job {}", job.id());
    }
  }

  private void probeMetadata(DownloadJob job) {
    try {
      MediaProbe probe = extractor.probe(job.sourceUrl());
      if (probe.type() != MediaProbe.Type.VIDEO) {
        LOGGER.debug("Job {} points at a playlist, no metadata applied", job.id());
        return;
      }
      VideoMetadata video = probe.video();
      jobStore.update(
          job.id(),
          JobPatch.metadata(
              video.title(), video.uploader(), video.durationSeconds(), video.thumbnailUrl()));
    } catch (DownloadException e) {
      LOGGER.warn("Metadata probe failed for job {}: {}", job.id(), e.getMessage());
    }
  }
}
