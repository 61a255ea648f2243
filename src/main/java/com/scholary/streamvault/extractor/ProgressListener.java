package com.scholary.streamvault.extractor;

/**
 * Receives progress samples from a running fetch, on the fetching thread, in emission order.
 */
@FunctionalInterface
public interface ProgressListener {

  /**
   * @param percent completion in the range 0..100
   * @param speedBytesPerSec current transfer rate, null when unknown
   * @param etaSeconds estimated seconds remaining, null when unknown
   */
  void onProgress(double percent, Long speedBytesPerSec, Long etaSeconds);
}
