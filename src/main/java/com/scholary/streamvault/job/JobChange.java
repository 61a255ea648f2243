package com.scholary.streamvault.job;

/**
 * A single committed mutation.
 *
 * @param previous the job before the change, null for creation
 * @param current the job after the change, null for deletion
 */
public record JobChange(DownloadJob previous, DownloadJob current) {

  public String jobId() {
    return current != null ? current.id() : previous.id();
  }

  /** True for creation, deletion and every state transition; false for progress and metadata. */
  public boolean stateChanged() {
    return previous == null || current == null || previous.state() != current.state();
  }
}
