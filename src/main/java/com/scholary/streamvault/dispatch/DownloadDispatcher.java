package com.scholary.streamvault.dispatch;

import com.scholary.streamvault.error.DownloadException;
import com.scholary.streamvault.error.ErrorKind;
import com.scholary.streamvault.extractor.CancellationSignal;
import com.scholary.streamvault.extractor.Extractor;
import com.scholary.streamvault.extractor.FetchResult;
import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.job.JobPatch;
import com.scholary.streamvault.job.JobStore;
import com.scholary.streamvault.job.JobStoreException;
import com.scholary.streamvault.logging.StructuredLogger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FIFO dispatch of queued jobs onto a bounded set of workers.
 *
 * <p>One loop thread owns the ready queue, the running set and the slot limit. Every public method
 * posts a task to that thread, so none of this state needs a lock. Workers run on the injected
 * pool and report their outcome back to the loop, which records it, frees the slot and starts the
 * next job.
 *
 * <p>A job is started by moving it to {@code downloading} in the job store. If the store rejects
 * that transition (the job was cancelled, scheduled or deleted while waiting) the id is skipped.
 * Stale ids in the ready queue are therefore harmless.
 *
 * <p>Lowering {@code maxDownloads} never interrupts running downloads; the pool shrinks as they
 * finish.
 *
 * <p>Jobs about to be removed are put on hold first: their fetches are stopped and they are not
 * started again until released, by which time their records are gone.
 */
public class DownloadDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadDispatcher.class);

  private final JobStore jobStore;
  private final Extractor extractor;
  private final Executor workerExecutor;
  private final RetryPolicy retryPolicy;
  private final StructuredLogger structuredLogger;
  private final ScheduledExecutorService loop;

  // Loop thread only.
  private final Set<String> ready = new LinkedHashSet<>();
  private final Map<String, RunningDownload> running = new HashMap<>();
  private final Map<String, Integer> held = new HashMap<>();
  private int holdAllCount;

  private volatile int maxDownloads;

  public DownloadDispatcher(
      JobStore jobStore,
      Extractor extractor,
      Executor workerExecutor,
      RetryPolicy retryPolicy,
      int maxDownloads) {
    if (maxDownloads < 1) {
      throw new IllegalArgumentException("maxDownloads must be >= 1");
    }
    this.jobStore = jobStore;
    this.extractor = extractor;
    this.workerExecutor = workerExecutor;
    this.retryPolicy = retryPolicy;
    this.maxDownloads = maxDownloads;
    this.structuredLogger = new StructuredLogger(LOGGER);
    this.loop =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "download-dispatch");
              thread.setDaemon(true);
              return thread;
            });
    LOGGER.info("Dispatcher started: maxDownloads={}, retry={}", maxDownloads, retryPolicy);
  }

  /** Append a queued job to the back of the ready queue. */
  public void enqueue(String jobId) {
    enqueueAll(List.of(jobId));
  }

  /** Append queued jobs in the given order. */
  public void enqueueAll(List<String> jobIds) {
    if (jobIds.isEmpty()) {
      return;
    }
    List<String> ids = List.copyOf(jobIds);
    submit(
        () -> {
          for (String id : ids) {
            if (!running.containsKey(id)) {
              ready.remove(id);
              ready.add(id);
            }
          }
          pump();
        });
  }

  /**
   * Cancel a queued or downloading job.
   *
   * <p>A queued job is cancelled in the store right away. A downloading job has its fetch
   * signalled and is recorded {@code cancelled} once the worker has stopped and cleaned up.
   *
   * @return completes when the job is no longer running
   */
  public CompletableFuture<Void> cancel(String jobId) {
    return CompletableFuture.supplyAsync(() -> cancelOnLoop(jobId), loop)
        .thenCompose(done -> done);
  }

  /**
   * Stop the given jobs and keep them from starting until {@link #release} is called.
   *
   * <p>Running fetches among them are signalled. Held ids keep their place in the ready queue but
   * are passed over, so a job that is about to be removed can neither start nor restart meanwhile.
   *
   * @return completes when none of the jobs is running any more
   */
  public CompletableFuture<Void> hold(Collection<String> jobIds) {
    List<String> ids = List.copyOf(jobIds);
    return CompletableFuture.supplyAsync(() -> holdOnLoop(ids), loop).thenCompose(done -> done);
  }

  /** Undo one {@link #hold} of the given jobs. */
  public void release(Collection<String> jobIds) {
    List<String> ids = List.copyOf(jobIds);
    submit(
        () -> {
          for (String id : ids) {
            held.computeIfPresent(id, (key, count) -> count > 1 ? count - 1 : null);
          }
          pump();
        });
  }

  /**
   * Stop every running job and start nothing until {@link #releaseAll} is called.
   *
   * @return completes when nothing is running any more
   */
  public CompletableFuture<Void> holdAll() {
    return CompletableFuture.supplyAsync(
            () -> {
              holdAllCount++;
              return stopRunning(List.copyOf(running.keySet()));
            },
            loop)
        .thenCompose(done -> done);
  }

  /** Undo one {@link #holdAll}. */
  public void releaseAll() {
    submit(
        () -> {
          holdAllCount = Math.max(0, holdAllCount - 1);
          pump();
        });
  }

  /** Change the slot limit. Takes effect immediately for new starts. */
  public void setMaxDownloads(int maxDownloads) {
    if (maxDownloads < 1) {
      throw new IllegalArgumentException("maxDownloads must be >= 1");
    }
    submit(
        () -> {
          int previous = this.maxDownloads;
          this.maxDownloads = maxDownloads;
          LOGGER.info("maxDownloads changed: {} -> {}", previous, maxDownloads);
          pump();
        });
  }

  public int getMaxDownloads() {
    return maxDownloads;
  }

  /**
   * Stop the loop. Running fetches are signalled so their processes exit; their jobs stay {@code
   * downloading} in the store and are re-queued by the next startup.
   */
  public void shutdown() {
    CompletableFuture<Void> signalled =
        CompletableFuture.runAsync(
            () -> running.values().forEach(download -> download.signal().cancel()), loop);
    try {
      signalled.get(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException | TimeoutException e) {
      LOGGER.warn("Could not signal running downloads on shutdown: {}", e.getMessage());
    }
    loop.shutdownNow();
    LOGGER.info("Dispatcher stopped");
  }

  private CompletableFuture<Void> cancelOnLoop(String jobId) {
    RunningDownload download = running.get(jobId);
    if (download != null) {
      LOGGER.info("Cancelling running download: jobId={}", jobId);
      download.signal().cancel();
      return download.done();
    }
    ready.remove(jobId);
    try {
      jobStore.update(jobId, JobPatch.cancel());
    } catch (DownloadException e) {
      LOGGER.debug("Nothing to cancel for job {}: {}", jobId, e.getMessage());
    }
    return CompletableFuture.completedFuture(null);
  }

  private CompletableFuture<Void> holdOnLoop(List<String> ids) {
    for (String id : ids) {
      held.merge(id, 1, Integer::sum);
    }
    return stopRunning(ids);
  }

  private CompletableFuture<Void> stopRunning(List<String> ids) {
    List<CompletableFuture<Void>> stopping = new ArrayList<>();
    for (String id : ids) {
      RunningDownload download = running.get(id);
      if (download != null) {
        download.signal().cancel();
        stopping.add(download.done());
      }
    }
    if (!stopping.isEmpty()) {
      LOGGER.info("Stopping {} running downloads", stopping.size());
    }
    return CompletableFuture.allOf(stopping.toArray(new CompletableFuture[0]));
  }

  private void pump() {
    if (holdAllCount > 0) {
      return;
    }
    Iterator<String> iterator = ready.iterator();
    while (running.size() < maxDownloads && iterator.hasNext()) {
      String jobId = iterator.next();
      if (held.containsKey(jobId)) {
        continue;
      }
      iterator.remove();

      DownloadJob job;
      try {
        job = jobStore.update(jobId, JobPatch.start());
      } catch (JobStoreException e) {
        LOGGER.warn("Could not start job {}, leaving it queued: {}", jobId, e.getMessage());
        continue;
      } catch (DownloadException e) {
        LOGGER.debug("Skipping job {}: {}", jobId, e.getMessage());
        continue;
      }
      launch(job);
    }
  }

  private void launch(DownloadJob job) {
    CancellationSignal signal = new CancellationSignal();
    RunningDownload download =
        new RunningDownload(job.id(), signal, new CompletableFuture<>(), Instant.now());
    running.put(job.id(), download);
    structuredLogger.logDownloadStarted(
        job.id(), job.retryCount() + 1, running.size(), maxDownloads);

    DownloadWorker worker =
        new DownloadWorker(
            job, extractor, jobStore, signal, result -> report(job.id(), result));
    try {
      workerExecutor.execute(worker);
    } catch (RejectedExecutionException e) {
      LOGGER.error("Worker pool rejected job {}", job.id(), e);
      running.remove(job.id());
      download.done().complete(null);
      recordQuietly(job.id(), JobPatch.fail("Worker pool rejected the download"));
    }
  }

  private void report(String jobId, FetchResult result) {
    try {
      loop.execute(guarded(() -> onFinished(jobId, result)));
    } catch (RejectedExecutionException e) {
      LOGGER.info("Dispatcher stopped, outcome of job {} not recorded", jobId);
    }
  }

  private void onFinished(String jobId, FetchResult result) {
    RunningDownload download = running.remove(jobId);
    long elapsedMs =
        download == null ? 0 : Duration.between(download.startedAt(), Instant.now()).toMillis();
    try {
      switch (result.outcome()) {
        case COMPLETED -> {
          recordQuietly(
              jobId, JobPatch.complete(result.file().toString(), result.sizeBytes()));
          structuredLogger.logDownloadFinished(
              jobId, "completed", elapsedMs, result.sizeBytes());
        }
        case CANCELLED -> {
          recordQuietly(jobId, JobPatch.cancel());
          structuredLogger.logDownloadFinished(jobId, "cancelled", elapsedMs, 0);
        }
        case FAILED -> onFailed(jobId, result);
        default -> throw new IllegalStateException("Unknown outcome: " + result.outcome());
      }
    } finally {
      if (download != null) {
        download.done().complete(null);
      }
      pump();
    }
  }

  private void onFailed(String jobId, FetchResult result) {
    DownloadJob failed = recordQuietly(jobId, JobPatch.fail(result.errorMessage()));
    if (failed == null) {
      return;
    }
    if (!result.retryable() || !retryPolicy.shouldRetry(failed.retryCount())) {
      structuredLogger.logDownloadFailed(
          jobId, failed.retryCount(), result.retryable(), result.errorMessage());
      return;
    }

    DownloadJob retried = recordQuietly(jobId, JobPatch.retry());
    if (retried == null) {
      return;
    }
    long backoffMs = retryPolicy.backoffMs(retried.retryCount());
    structuredLogger.logDownloadRetry(
        jobId, retried.retryCount(), retryPolicy.maxRetries(), backoffMs, result.errorMessage());
    if (backoffMs <= 0) {
      ready.add(jobId);
    } else {
      loop.schedule(
          guarded(
              () -> {
                ready.add(jobId);
                pump();
              }),
          backoffMs,
          TimeUnit.MILLISECONDS);
    }
  }

  /** Apply a patch, logging instead of failing when the job is gone or moved on. */
  private DownloadJob recordQuietly(String jobId, JobPatch patch) {
    try {
      return jobStore.update(jobId, patch);
    } catch (DownloadException e) {
      if (e.getKind() == ErrorKind.NOT_FOUND) {
        LOGGER.debug("Job {} was removed, {} not recorded", jobId, patch.targetState());
      } else {
        LOGGER.warn(
            "Could not record {} for job {}: {}", patch.targetState(), jobId, e.getMessage());
      }
      return null;
    }
  }

  private void submit(Runnable task) {
    try {
      loop.execute(guarded(task));
    } catch (RejectedExecutionException e) {
      throw new IllegalStateException("Dispatcher is shut down", e);
    }
  }

  /** Keeps a failing task from being lost silently inside the executor. */
  private static Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.error("Dispatch task failed", e);
      }
    };
  }

  private record RunningDownload(
      String jobId, CancellationSignal signal, CompletableFuture<Void> done, Instant startedAt) {}
}
