package com.scholary.streamvault.dispatch;

/**
 * Automatic retry settings for failed downloads.
 *
 * <p>The n-th retry waits {@code initialBackoffMs * multiplier^(n-1)} milliseconds, capped at
 * {@code maxBackoffMs}. A zero initial backoff re-queues immediately.
 *
 * @param enabled whether failed jobs are retried at all
 * @param maxRetries retries allowed per job after the first attempt
 * @param initialBackoffMs delay before the first retry
 * @param multiplier growth factor between consecutive retries
 * @param maxBackoffMs upper bound on the delay
 */
public record RetryPolicy(
    boolean enabled, int maxRetries, long initialBackoffMs, double multiplier, long maxBackoffMs) {

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
  }

  public static RetryPolicy disabled() {
    return new RetryPolicy(false, 0, 0, 1.0, 0);
  }

  /** Retries without delay. */
  public static RetryPolicy immediate(int maxRetries) {
    return new RetryPolicy(true, maxRetries, 0, 1.0, 0);
  }

  /**
   * @param retryCount retries already spent by the job
   */
  public boolean shouldRetry(int retryCount) {
    return enabled && retryCount < maxRetries;
  }

  /**
   * Delay before the given retry.
   *
   * @param attempt 1-based retry number
   */
  public long backoffMs(int attempt) {
    if (initialBackoffMs <= 0) {
      return 0;
    }
    double delay = initialBackoffMs * Math.pow(multiplier, Math.max(0, attempt - 1));
    return (long) Math.min(delay, (double) Math.max(maxBackoffMs, initialBackoffMs));
  }
}
