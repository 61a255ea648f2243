package com.scholary.streamvault.error;

/**
 * Machine-readable failure categories.
 *
 * <p>Every error surfaced by the orchestrator carries one of these kinds so API clients can branch
 * on it without parsing messages.
 */
public enum ErrorKind {
  /** Malformed or unsupported input URL. Raised before any job is created. */
  INVALID_URL,
  /** Request payload failed validation (bad options, bad template, bad pool size). */
  INVALID_REQUEST,
  /** The job, file or remote media does not exist. */
  NOT_FOUND,
  /** The extractor cannot handle the source. */
  UNSUPPORTED,
  /** Transient network or extraction failure. Eligible for automatic retry. */
  EXTRACT_ERROR,
  /** Operation not valid for the job's current state. */
  INVALID_STATE,
  /** Fire time is unparseable or in the past. */
  INVALID_TIME,
  /** User-initiated cancellation. A terminal outcome rather than a fault. */
  CANCELLED,
  /** Persistence failure. The job keeps its last-known-good state. */
  STORE_ERROR
}
