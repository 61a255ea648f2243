package com.scholary.streamvault.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states of a download job and the legal transitions between them.
 *
 * <pre>
 * queued      -> scheduled | downloading | cancelled
 * scheduled   -> queued | cancelled
 * downloading -> completed | failed | cancelled
 * failed      -> queued   (automatic retry)
 * </pre>
 *
 * <p>{@code completed} and {@code cancelled} have no outgoing edges. {@code failed} only leaves
 * through the retry edge, which the dispatcher takes while the retry budget lasts.
 */
public enum JobState {
  QUEUED,
  SCHEDULED,
  DOWNLOADING,
  COMPLETED,
  FAILED,
  CANCELLED;

  static {
    QUEUED.next = EnumSet.of(SCHEDULED, DOWNLOADING, CANCELLED);
    SCHEDULED.next = EnumSet.of(QUEUED, CANCELLED);
    DOWNLOADING.next = EnumSet.of(COMPLETED, FAILED, CANCELLED);
    FAILED.next = EnumSet.of(QUEUED);
    COMPLETED.next = EnumSet.noneOf(JobState.class);
    CANCELLED.next = EnumSet.noneOf(JobState.class);
  }

  private Set<JobState> next;

  public boolean canTransitionTo(JobState target) {
    return next.contains(target);
  }

  /** Terminal states accept no mutation other than deletion (and the retry edge for FAILED). */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  /** Queued, scheduled and downloading jobs are the ones shown as in-flight to observers. */
  public boolean isActive() {
    return !isTerminal();
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobState fromWireName(String value) {
    return JobState.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
