package com.scholary.streamvault.dispatch;

import com.scholary.streamvault.error.DownloadException;
import com.scholary.streamvault.extractor.CancellationSignal;
import com.scholary.streamvault.extractor.Extractor;
import com.scholary.streamvault.extractor.ExtractorException;
import com.scholary.streamvault.extractor.FetchRequest;
import com.scholary.streamvault.extractor.FetchResult;
import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.job.JobPatch;
import com.scholary.streamvault.job.JobStore;
import com.scholary.streamvault.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

/**
 * Runs one fetch on a pool thread.
 *
 * <p>Progress goes straight to the job store in emission order. The terminal outcome is handed to
 * the dispatch loop through {@code onFinished}, after partial files have been removed. Nothing
 * thrown by the extractor escapes this class.
 */
final class DownloadWorker implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadWorker.class);

  private final DownloadJob job;
  private final Extractor extractor;
  private final JobStore jobStore;
  private final CancellationSignal signal;
  private final Consumer<FetchResult> onFinished;

  DownloadWorker(
      DownloadJob job,
      Extractor extractor,
      JobStore jobStore,
      CancellationSignal signal,
      Consumer<FetchResult> onFinished) {
    this.job = job;
    this.extractor = extractor;
    this.jobStore = jobStore;
    this.signal = signal;
    this.onFinished = onFinished;
  }

  @Override
  public void run() {
    StructuredLogger.setJobContext(job.id(), job.sourceUrl());
    FetchResult result = null;
    try {
      result = fetch();
      if (signal.isCancelled() && result.outcome() == FetchResult.Outcome.COMPLETED) {
        // Finished just as the cancel arrived. Cancellation wins and the file goes.
        LOGGER.info("Discarding file of cancelled job: {}", result.file());
        result = FetchResult.cancelled(List.of(result.file()));
      }
      if (result.outcome() != FetchResult.Outcome.COMPLETED) {
        removePartials(result.partialFiles());
      }
    } finally {
      try {
        onFinished.accept(
            result != null ? result : FetchResult.failed("Worker aborted", true, List.of()));
      } finally {
        StructuredLogger.clearJobContext();
      }
    }
  }

  private FetchResult fetch() {
    try {
      FetchResult result =
          extractor.fetch(
              new FetchRequest(job.id(), job.sourceUrl(), job.options()),
              this::onProgress,
              signal);
      if (result == null) {
        return FetchResult.failed("Extractor returned no result", true, List.of());
      }
      return result;
    } catch (ExtractorException e) {
      if (signal.isCancelled()) {
        return FetchResult.cancelled(List.of());
      }
      return FetchResult.failed(e.getMessage(), e.isRetryable(), List.of());
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error while downloading job {}", job.id(), e);
      if (signal.isCancelled()) {
        return FetchResult.cancelled(List.of());
      }
      return FetchResult.failed("Unexpected error: " + e.getMessage(), true, List.of());
    }
  }

  private void onProgress(double percent, Long speedBytesPerSec, Long etaSeconds) {
    if (signal.isCancelled()) {
      return;
    }
    try {
      jobStore.update(job.id(), JobPatch.progress(percent, speedBytesPerSec, etaSeconds));
    } catch (DownloadException e) {
      // Job deleted or already finished; later samples are irrelevant.
      LOGGER.debug("Dropped progress for job {}: {}", job.id(), e.getMessage());
    }
  }

  private void removePartials(List<Path> partials) {
    for (Path partial : partials) {
      try {
        if (FileSystemUtils.deleteRecursively(partial)) {
          LOGGER.debug("Removed partial file {}", partial);
        }
      } catch (IOException e) {
        LOGGER.warn("Could not remove partial file {}: {}", partial, e.getMessage());
      }
    }
  }
}
