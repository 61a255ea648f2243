package com.scholary.streamvault.support;

import com.scholary.streamvault.error.DownloadException;
import com.scholary.streamvault.extractor.CancellationSignal;
import com.scholary.streamvault.extractor.Extractor;
import com.scholary.streamvault.extractor.FetchRequest;
import com.scholary.streamvault.extractor.FetchResult;
import com.scholary.streamvault.extractor.MediaProbe;
import com.scholary.streamvault.extractor.ProgressListener;
import com.scholary.streamvault.extractor.VideoMetadata;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process extractor driven by per-URL scripts.
 *
 * <p>Each fetch consumes the next {@link Behavior} scripted for its URL, defaulting to {@link
 * Behavior#COMPLETE}. Blocking fetches report one progress sample, leave a partial file in their
 * working directory and wait until released or cancelled.
 */
public class ScriptedExtractor implements Extractor {

  public enum Behavior {
    COMPLETE,
    FAIL_RETRYABLE,
    FAIL_PERMANENT,
    BLOCK
  }

  private final Path downloadDir;
  private final Map<String, Deque<Behavior>> scripts = new ConcurrentHashMap<>();
  private final Map<String, MediaProbe> probes = new ConcurrentHashMap<>();
  private final Map<String, DownloadException> probeFailures = new ConcurrentHashMap<>();
  private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
  private final Map<String, CountDownLatch> started = new ConcurrentHashMap<>();
  private final List<String> fetchOrder = new CopyOnWriteArrayList<>();
  private final AtomicInteger active = new AtomicInteger();
  private final AtomicInteger maxActive = new AtomicInteger();
  private final AtomicInteger probeCount = new AtomicInteger();

  public ScriptedExtractor(Path downloadDir) {
    this.downloadDir = downloadDir;
  }

  public ScriptedExtractor script(String url, Behavior... behaviors) {
    scripts.computeIfAbsent(url, key -> new ArrayDeque<>()).addAll(Arrays.asList(behaviors));
    return this;
  }

  public ScriptedExtractor probeResult(String url, MediaProbe probe) {
    probes.put(url, probe);
    return this;
  }

  public ScriptedExtractor probeFailure(String url, DownloadException failure) {
    probeFailures.put(url, failure);
    return this;
  }

  /** Let a blocked fetch of {@code url} complete. */
  public void release(String url) {
    gate(url).countDown();
  }

  /** Wait until a blocking fetch of {@code url} has started. */
  public void awaitStarted(String url) throws InterruptedException {
    if (!startedLatch(url).await(10, TimeUnit.SECONDS)) {
      throw new AssertionError("Fetch of " + url + " did not start");
    }
  }

  public List<String> fetchOrder() {
    return List.copyOf(fetchOrder);
  }

  public int maxConcurrent() {
    return maxActive.get();
  }

  public int probeCount() {
    return probeCount.get();
  }

  public Path workDir(String jobId) {
    return downloadDir.resolve(".work").resolve(jobId);
  }

  @Override
  public MediaProbe probe(String url) {
    probeCount.incrementAndGet();
    DownloadException failure = probeFailures.get(url);
    if (failure != null) {
      throw failure;
    }
    MediaProbe probe = probes.get(url);
    if (probe != null) {
      return probe;
    }
    return MediaProbe.video(
        new VideoMetadata("id", url, "Title of " + url, "Uploader", 60L, null, 10L, "20240101"));
  }

  @Override
  public FetchResult fetch(
      FetchRequest request, ProgressListener listener, CancellationSignal signal) {
    fetchOrder.add(request.url());
    int now = active.incrementAndGet();
    maxActive.accumulateAndGet(now, Math::max);
    try {
      Behavior behavior = nextBehavior(request.url());
      switch (behavior) {
        case FAIL_RETRYABLE:
          return FetchResult.failed("Connection reset", true, List.of());
        case FAIL_PERMANENT:
          return FetchResult.failed("Video unavailable", false, List.of());
        case BLOCK:
          return blockingFetch(request, listener, signal);
        case COMPLETE:
        default:
          listener.onProgress(50.0, 1000L, 5L);
          listener.onProgress(100.0, 1000L, 0L);
          return complete(request);
      }
    } finally {
      active.decrementAndGet();
    }
  }

  private FetchResult blockingFetch(
      FetchRequest request, ProgressListener listener, CancellationSignal signal) {
    Path workDir = workDir(request.jobId());
    try {
      Files.createDirectories(workDir);
      Files.writeString(workDir.resolve("video.mp4.part"), "partial");
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    listener.onProgress(10.0, 2048L, 30L);
    startedLatch(request.url()).countDown();

    CountDownLatch gate = gate(request.url());
    signal.onCancel(gate::countDown);
    try {
      if (!gate.await(30, TimeUnit.SECONDS)) {
        return FetchResult.failed("Test gate timed out", false, List.of(workDir));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return FetchResult.cancelled(List.of(workDir));
    }
    if (signal.isCancelled()) {
      return FetchResult.cancelled(List.of(workDir));
    }
    listener.onProgress(100.0, 2048L, 0L);
    return complete(request);
  }

  private FetchResult complete(FetchRequest request) {
    try {
      Files.createDirectories(downloadDir);
      String extension = request.options().format().extension();
      Path file = downloadDir.resolve(request.jobId() + "." + extension);
      Files.writeString(file, "video-bytes");
      return FetchResult.completed(file, Files.size(file));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private Behavior nextBehavior(String url) {
    Deque<Behavior> script = scripts.get(url);
    if (script == null) {
      return Behavior.COMPLETE;
    }
    synchronized (script) {
      Behavior next = script.pollFirst();
      return next == null ? Behavior.COMPLETE : next;
    }
  }

  private CountDownLatch gate(String url) {
    return gates.computeIfAbsent(url, key -> new CountDownLatch(1));
  }

  private CountDownLatch startedLatch(String url) {
    return started.computeIfAbsent(url, key -> new CountDownLatch(1));
  }
}
