package com.scholary.streamvault.extractor;

/**
 * Abstraction over the external media extraction tool.
 *
 * <p>Keeps the orchestrator independent of how bytes are actually obtained, and lets tests drive
 * the dispatcher with a scripted implementation.
 */
public interface Extractor extends AutoCloseable {

  /**
   * Resolve a URL to video or playlist metadata without downloading anything.
   *
   * @param url the source URL
   * @return the probe result
   * @throws ExtractorException NOT_FOUND or UNSUPPORTED for bad input, EXTRACT_ERROR otherwise
   */
  MediaProbe probe(String url);

  /**
   * Download one video. May run for minutes.
   *
   * <p>Progress is reported through {@code listener} zero or more times before this method
   * returns. Once {@code signal} is cancelled the fetch stops within a bounded grace period and
   * returns a CANCELLED result. Failures are returned, not thrown.
   *
   * @param request what to fetch and how
   * @param listener progress sink, called on the current thread
   * @param signal external cancellation
   * @return the terminal outcome
   */
  FetchResult fetch(FetchRequest request, ProgressListener listener, CancellationSignal signal);

  /** Release background resources. The default holds none. */
  @Override
  default void close() {}
}
