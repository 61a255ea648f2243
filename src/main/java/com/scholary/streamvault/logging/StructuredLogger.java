package com.scholary.streamvault.logging;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log job lifecycle events with structured fields that log shippers can
 * index.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log jobs created by one submission. */
  public void logJobsSubmitted(String source, int requested, int created) {
    try {
      MDC.put("event_type", "jobs_submitted");
      MDC.put("source", source);
      MDC.put("requested", String.valueOf(requested));
      MDC.put("created", String.valueOf(created));

      logger.info(
          "Jobs submitted: source={}, requested={}, created={}", source, requested, created);
    } finally {
      clearEventFields();
    }
  }

  /** Log download started event. */
  public void logDownloadStarted(String jobId, int attempt, int running, int maxDownloads) {
    try {
      MDC.put("event_type", "download_started");
      MDC.put("jobId", jobId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("running", String.valueOf(running));
      MDC.put("maxDownloads", String.valueOf(maxDownloads));

      logger.info(
          "Download started: jobId={}, attempt={}, slots={}/{}",
          jobId,
          attempt,
          running,
          maxDownloads);
    } finally {
      clearEventFields();
    }
  }

  /** Log download finished event (any terminal outcome). */
  public void logDownloadFinished(String jobId, String outcome, long elapsedMs, long sizeBytes) {
    try {
      MDC.put("event_type", "download_finished");
      MDC.put("jobId", jobId);
      MDC.put("outcome", outcome);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));
      MDC.put("sizeBytes", String.valueOf(sizeBytes));

      logger.info(
          "Download finished: jobId={}, outcome={}, elapsed={}ms, size={} bytes",
          jobId,
          outcome,
          elapsedMs,
          sizeBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log download retry event. */
  public void logDownloadRetry(
      String jobId, int attempt, int maxRetries, long backoffMs, String message) {
    try {
      MDC.put("event_type", "download_retry");
      MDC.put("jobId", jobId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("backoffMs", String.valueOf(backoffMs));

      logger.warn(
          "Download retry: jobId={}, retry={}/{}, backoff={}ms, error={}",
          jobId,
          attempt,
          maxRetries,
          backoffMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log permanent download failure event. */
  public void logDownloadFailed(String jobId, int retries, boolean retryable, String message) {
    try {
      MDC.put("event_type", "download_failed");
      MDC.put("jobId", jobId);
      MDC.put("retries", String.valueOf(retries));
      MDC.put("retryable", String.valueOf(retryable));

      logger.error(
          "Download failed: jobId={}, retries={}, retryable={}, error={}",
          jobId,
          retries,
          retryable,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log schedule entry created or replaced. */
  public void logJobScheduled(String jobId, Instant fireAt) {
    try {
      MDC.put("event_type", "job_scheduled");
      MDC.put("jobId", jobId);
      MDC.put("fireAt", String.valueOf(fireAt));

      logger.info("Job scheduled: jobId={}, fireAt={}", jobId, fireAt);
    } finally {
      clearEventFields();
    }
  }

  /** Log schedule entry promoted to the dispatch queue. */
  public void logSchedulePromoted(String jobId, Instant fireAt, long lateMs) {
    try {
      MDC.put("event_type", "schedule_promoted");
      MDC.put("jobId", jobId);
      MDC.put("fireAt", String.valueOf(fireAt));
      MDC.put("lateMs", String.valueOf(lateMs));

      logger.info("Schedule fired: jobId={}, fireAt={}, late={}ms", jobId, fireAt, lateMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log an observer removed from the broadcast set. */
  public void logObserverDropped(String observerId, String reason) {
    try {
      MDC.put("event_type", "observer_dropped");
      MDC.put("observerId", observerId);

      logger.warn("Observer dropped: id={}, reason={}", observerId, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String url) {
    MDC.put("jobId", jobId);
    MDC.put("url", url);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("url");
  }

  /** Clear event-specific fields from MDC. Events are never logged from worker threads. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("jobId");
    MDC.remove("source");
    MDC.remove("requested");
    MDC.remove("created");
    MDC.remove("attempt");
    MDC.remove("running");
    MDC.remove("maxDownloads");
    MDC.remove("outcome");
    MDC.remove("elapsedMs");
    MDC.remove("sizeBytes");
    MDC.remove("maxRetries");
    MDC.remove("backoffMs");
    MDC.remove("retries");
    MDC.remove("retryable");
    MDC.remove("fireAt");
    MDC.remove("lateMs");
    MDC.remove("observerId");
  }
}
