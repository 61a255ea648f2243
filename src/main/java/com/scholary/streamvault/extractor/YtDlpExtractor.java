package com.scholary.streamvault.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.streamvault.error.ErrorKind;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

/**
 * Extractor backed by the yt-dlp executable.
 *
 * <p>Each fetch runs in a private working directory ({@code <downloadDir>/.work/<jobId>}). On
 * success the finished file is moved into the download directory; on failure or cancellation the
 * working directory is reported as a partial so the caller can remove it.
 *
 * <p>Cancellation destroys the process. If it has not exited after the grace period it is killed
 * forcibly. A watchdog does the same after the fetch timeout so no download hangs forever.
 */
public class YtDlpExtractor implements Extractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpExtractor.class);

  private static final String WORK_DIR_NAME = ".work";

  private final ExtractorProperties properties;
  private final ObjectMapper objectMapper;
  private final YtDlpCommandBuilder commandBuilder;
  private final Path downloadDir;
  private final ScheduledExecutorService watchdog;

  public YtDlpExtractor(ExtractorProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.commandBuilder = new YtDlpCommandBuilder(properties);
    this.downloadDir = Paths.get(properties.downloadDir()).toAbsolutePath();
    this.watchdog =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "yt-dlp-watchdog");
              thread.setDaemon(true);
              return thread;
            });

    try {
      Files.createDirectories(downloadDir.resolve(WORK_DIR_NAME));
    } catch (IOException e) {
      throw new RuntimeException("Failed to create download directory: " + downloadDir, e);
    }
    LOGGER.info(
        "Initialized yt-dlp extractor: binary={}, downloadDir={}",
        properties.binaryPath(),
        downloadDir);
  }

  @Override
  public MediaProbe probe(String url) {
    List<String> command = commandBuilder.probeCommand(url);
    LOGGER.debug("Probe command: {}", String.join(" ", command));

    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException e) {
      throw new ExtractorException(
          ErrorKind.EXTRACT_ERROR, "Failed to start yt-dlp: " + e.getMessage(), e);
    }

    CompletableFuture<String> stderr = readAsync(process.getErrorStream());
    CompletableFuture<String> stdout = readAsync(process.getInputStream());
    try {
      if (!process.waitFor(properties.probeTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new ExtractorException(
            ErrorKind.EXTRACT_ERROR,
            "Probe timed out after " + properties.probeTimeoutSeconds() + "s: " + url);
      }
      String errorOutput = stderr.get(properties.cancelGraceSeconds(), TimeUnit.SECONDS);
      String output = stdout.get(properties.cancelGraceSeconds(), TimeUnit.SECONDS);

      if (process.exitValue() != 0) {
        String message = lastError(errorOutput);
        ErrorKind kind = YtDlpOutputParser.classifyError(message);
        LOGGER.warn("Probe failed: url={}, kind={}, message={}", url, kind, message);
        throw new ExtractorException(kind, "Could not extract video info: " + message);
      }
      if (output.isBlank()) {
        throw new ExtractorException(ErrorKind.EXTRACT_ERROR, "Probe returned empty output");
      }

      JsonNode root = objectMapper.readTree(output);
      MediaProbe probe = YtDlpOutputParser.parseProbe(root, url);
      LOGGER.info("Probed {}: type={}", url, probe.type());
      return probe;

    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ExtractorException(ErrorKind.EXTRACT_ERROR, "Probe interrupted", e);
    } catch (ExecutionException | TimeoutException | IOException e) {
      throw new ExtractorException(
          ErrorKind.EXTRACT_ERROR, "Failed to read probe output: " + e.getMessage(), e);
    }
  }

  @Override
  public FetchResult fetch(
      FetchRequest request, ProgressListener listener, CancellationSignal signal) {
    Path workDir = downloadDir.resolve(WORK_DIR_NAME).resolve(request.jobId());
    List<Path> partials = List.of(workDir);
    try {
      Files.createDirectories(workDir);
    } catch (IOException e) {
      return FetchResult.failed(
          "Cannot create working directory: " + e.getMessage(), true, partials);
    }

    List<String> command = commandBuilder.fetchCommand(request.url(), request.options(), workDir);
    LOGGER.info("Starting yt-dlp: jobId={}, url={}", request.jobId(), request.url());
    LOGGER.debug("Fetch command: {}", String.join(" ", command));

    Process process;
    try {
      process = new ProcessBuilder(command).redirectErrorStream(true).start();
    } catch (IOException e) {
      return FetchResult.failed("Failed to start yt-dlp: " + e.getMessage(), true, partials);
    }

    AtomicBoolean timedOut = new AtomicBoolean();
    signal.onCancel(process::destroy);
    ScheduledFuture<?> timeout =
        watchdog.schedule(
            () -> {
              timedOut.set(true);
              process.destroy();
            },
            properties.fetchTimeoutMinutes(),
            TimeUnit.MINUTES);

    Path printedFile = null;
    String lastError = null;
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (signal.isCancelled()) {
          process.destroy();
          continue;
        }
        var progress = YtDlpOutputParser.parseProgress(line);
        if (progress.isPresent()) {
          var sample = progress.get();
          listener.onProgress(sample.percent(), sample.speedBytesPerSec(), sample.etaSeconds());
          continue;
        }
        var file = YtDlpOutputParser.parseFilePath(line);
        if (file.isPresent()) {
          printedFile = file.get();
          continue;
        }
        var error = YtDlpOutputParser.parseError(line);
        if (error.isPresent()) {
          lastError = error.get();
          LOGGER.warn("yt-dlp error: jobId={}, message={}", request.jobId(), lastError);
        }
      }
    } catch (IOException e) {
      if (!signal.isCancelled() && !timedOut.get()) {
        lastError = "Failed to read yt-dlp output: " + e.getMessage();
      }
    } finally {
      timeout.cancel(false);
    }

    int exitCode;
    try {
      exitCode = awaitExit(process);
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      return FetchResult.cancelled(partials);
    }

    if (signal.isCancelled()) {
      LOGGER.info("yt-dlp cancelled: jobId={}", request.jobId());
      return FetchResult.cancelled(partials);
    }
    if (timedOut.get()) {
      return FetchResult.failed(
          "Download timed out after " + properties.fetchTimeoutMinutes() + " minutes",
          true,
          partials);
    }
    if (exitCode != 0 || printedFile == null) {
      String message =
          lastError != null ? lastError : "yt-dlp exited with code " + exitCode + " and no file";
      ErrorKind kind = YtDlpOutputParser.classifyError(message);
      return FetchResult.failed(message, kind == ErrorKind.EXTRACT_ERROR, partials);
    }

    try {
      Path finalFile = moveIntoDownloads(printedFile);
      long size = Files.size(finalFile);
      deleteQuietly(workDir);
      LOGGER.info(
          "yt-dlp finished: jobId={}, file={}, size={}", request.jobId(), finalFile, size);
      return FetchResult.completed(finalFile, size);
    } catch (IOException e) {
      return FetchResult.failed(
          "Failed to store downloaded file: " + e.getMessage(), true, partials);
    }
  }

  /** Stop the watchdog thread. Called by the container on shutdown. */
  @Override
  public void close() {
    watchdog.shutdownNow();
  }

  private int awaitExit(Process process) throws InterruptedException {
    if (!process.waitFor(properties.cancelGraceSeconds(), TimeUnit.SECONDS)) {
      LOGGER.warn("yt-dlp did not exit within {}s, killing it", properties.cancelGraceSeconds());
      process.destroyForcibly();
      process.waitFor(properties.cancelGraceSeconds(), TimeUnit.SECONDS);
    }
    return process.isAlive() ? -1 : process.exitValue();
  }

  /** Move the finished file next to earlier downloads, adding a suffix on name clashes. */
  private Path moveIntoDownloads(Path file) throws IOException {
    String filename = file.getFileName().toString();
    Path target = downloadDir.resolve(filename);
    if (Files.exists(target)) {
      int dot = filename.lastIndexOf('.');
      String base = dot > 0 ? filename.substring(0, dot) : filename;
      String extension = dot > 0 ? filename.substring(dot) : "";
      target = downloadDir.resolve(base + "_" + System.currentTimeMillis() + extension);
      LOGGER.info("File already exists, using new name: {}", target.getFileName());
    }
    return Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
  }

  private static void deleteQuietly(Path directory) {
    try {
      FileSystemUtils.deleteRecursively(directory);
    } catch (IOException e) {
      LOGGER.warn("Could not clean working directory {}: {}", directory, e.getMessage());
    }
  }

  private static CompletableFuture<String> readAsync(InputStream stream) {
    return CompletableFuture.supplyAsync(
        () -> {
          try {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
          } catch (IOException e) {
            throw new ExtractorException(
                ErrorKind.EXTRACT_ERROR, "Failed to read yt-dlp output", e);
          }
        });
  }

  private static String lastError(String errorOutput) {
    String last = null;
    for (String line : errorOutput.split("\n")) {
      var error = YtDlpOutputParser.parseError(line);
      if (error.isPresent()) {
        last = error.get();
      }
    }
    if (last != null) {
      return last;
    }
    String trimmed = errorOutput.trim();
    return trimmed.isEmpty() ? "unknown error" : trimmed;
  }
}
