package com.scholary.streamvault.notify;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.job.JobChange;
import com.scholary.streamvault.job.JobChangeListener;
import com.scholary.streamvault.job.JobStore;
import com.scholary.streamvault.logging.StructuredLogger;
import com.scholary.streamvault.stats.StatisticsAggregator;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans job and statistics changes out to connected observers.
 *
 * <p>Publishing runs on one dedicated thread, so neither the dispatcher nor workers ever wait on
 * an observer. Every publish builds a single message from one consistent store listing and offers
 * it to each observer; an observer that refuses or throws is dropped.
 *
 * <p>State changes publish right away, but at most one publish is ever waiting: changes that
 * arrive while one is queued are covered by it, since the message is built when it runs.
 * Progress-only changes are coalesced per job: at most one publish per progress interval, with a
 * periodic flush so the last sample is never lost. A heartbeat publish keeps idle observers in
 * sync.
 */
public class UpdateBroadcaster implements JobChangeListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(UpdateBroadcaster.class);

  private final JobStore jobStore;
  private final Clock clock;
  private final long progressIntervalMs;
  private final long heartbeatIntervalMs;
  private final StructuredLogger structuredLogger;

  private final Set<UpdateObserver> observers = ConcurrentHashMap.newKeySet();
  private final Cache<String, Long> lastProgressPush;
  private final AtomicBoolean progressPending = new AtomicBoolean();
  private final AtomicBoolean publishQueued = new AtomicBoolean();
  private final ScheduledExecutorService publisher;

  public UpdateBroadcaster(
      JobStore jobStore, Clock clock, long progressIntervalMs, long heartbeatIntervalMs) {
    this.jobStore = jobStore;
    this.clock = clock;
    this.progressIntervalMs = progressIntervalMs;
    this.heartbeatIntervalMs = heartbeatIntervalMs;
    this.structuredLogger = new StructuredLogger(LOGGER);
    this.lastProgressPush =
        Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(Duration.ofMillis(Math.max(progressIntervalMs * 10, 10_000)))
            .build();
    this.publisher =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "update-broadcast");
              thread.setDaemon(true);
              return thread;
            });
  }

  /** Start the coalescing flush and the heartbeat. */
  public void start() {
    publisher.scheduleWithFixedDelay(
        this::flushPendingProgress, progressIntervalMs, progressIntervalMs, TimeUnit.MILLISECONDS);
    if (heartbeatIntervalMs > 0) {
      publisher.scheduleWithFixedDelay(
          this::publish, heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
    }
    LOGGER.info(
        "Broadcaster started: progressInterval={}ms, heartbeat={}ms",
        progressIntervalMs,
        heartbeatIntervalMs);
  }

  public void shutdown() {
    publisher.shutdownNow();
  }

  /** Add an observer and send it the current state. */
  public void register(UpdateObserver observer) {
    observers.add(observer);
    LOGGER.info("Observer connected: id={}, observers={}", observer.id(), observers.size());
    requestPublish();
  }

  /** Remove one observer. Others are unaffected. */
  public void unregister(UpdateObserver observer) {
    if (observers.remove(observer)) {
      LOGGER.info("Observer disconnected: id={}, observers={}", observer.id(), observers.size());
    }
  }

  public int observerCount() {
    return observers.size();
  }

  @Override
  public void onJobChanged(JobChange change) {
    if (change.previous() == null || change.current() == null || change.stateChanged()) {
      if (change.current() == null) {
        lastProgressPush.invalidate(change.jobId());
      }
      requestPublish();
      return;
    }

    long now = clock.millis();
    Long last = lastProgressPush.getIfPresent(change.jobId());
    if (last == null || now - last >= progressIntervalMs) {
      lastProgressPush.put(change.jobId(), now);
      requestPublish();
    } else {
      progressPending.set(true);
    }
  }

  /** Build the current message and offer it to every observer. Runs on the publisher thread. */
  void publish() {
    if (observers.isEmpty()) {
      return;
    }
    StatsUpdateMessage message = buildMessage();
    for (UpdateObserver observer : observers) {
      try {
        if (!observer.offer(message)) {
          drop(observer, "send buffer full or connection closed");
        }
      } catch (RuntimeException e) {
        drop(observer, e.getMessage());
      }
    }
  }

  StatsUpdateMessage buildMessage() {
    List<DownloadJob> jobs = jobStore.list();
    Map<String, DownloadJob> active = new LinkedHashMap<>();
    for (DownloadJob job : jobs) {
      if (!job.state().isTerminal()) {
        active.put(job.id(), job);
      }
    }
    return StatsUpdateMessage.of(StatisticsAggregator.aggregate(jobs), active);
  }

  private void flushPendingProgress() {
    if (progressPending.getAndSet(false)) {
      publish();
    }
  }

  private void requestPublish() {
    if (!publishQueued.compareAndSet(false, true)) {
      return;
    }
    try {
      publisher.execute(
          () -> {
            publishQueued.set(false);
            publish();
          });
    } catch (RejectedExecutionException e) {
      publishQueued.set(false);
      LOGGER.debug("Broadcaster stopped, update not published");
    }
  }

  private void drop(UpdateObserver observer, String reason) {
    if (observers.remove(observer)) {
      structuredLogger.logObserverDropped(observer.id(), reason);
    }
  }
}
