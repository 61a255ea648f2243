package com.scholary.streamvault.extractor;

import java.nio.file.Path;
import java.util.List;

/**
 * Terminal outcome of a fetch.
 *
 * <ul>
 *   <li>COMPLETED: {@code file} and {@code sizeBytes} describe the finished download
 *   <li>FAILED: {@code errorMessage} explains why; {@code retryable} tells the dispatcher whether
 *       another attempt could succeed
 *   <li>CANCELLED: the fetch stopped on request
 * </ul>
 *
 * <p>FAILED and CANCELLED results list the partial files the fetch left behind. The caller owns
 * their removal.
 */
public record FetchResult(
    Outcome outcome,
    Path file,
    long sizeBytes,
    String errorMessage,
    boolean retryable,
    List<Path> partialFiles) {

  public enum Outcome {
    COMPLETED,
    FAILED,
    CANCELLED
  }

  public FetchResult {
    partialFiles = partialFiles == null ? List.of() : List.copyOf(partialFiles);
  }

  public static FetchResult completed(Path file, long sizeBytes) {
    return new FetchResult(Outcome.COMPLETED, file, sizeBytes, null, false, List.of());
  }

  public static FetchResult failed(String errorMessage, boolean retryable, List<Path> partials) {
    return new FetchResult(Outcome.FAILED, null, 0, errorMessage, retryable, partials);
  }

  public static FetchResult cancelled(List<Path> partials) {
    return new FetchResult(Outcome.CANCELLED, null, 0, null, false, partials);
  }
}
