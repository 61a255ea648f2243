package com.scholary.streamvault.job;

import com.scholary.streamvault.error.DownloadException;
import com.scholary.streamvault.error.ErrorKind;

/**
 * Thrown when the persistent record store cannot be read or written.
 *
 * <p>The in-memory view is only updated after the write succeeds, so the job stays in its
 * last-known-good state.
 */
public class JobStoreException extends DownloadException {

  public JobStoreException(String message) {
    super(ErrorKind.STORE_ERROR, message);
  }

  public JobStoreException(String message, Throwable cause) {
    super(ErrorKind.STORE_ERROR, message, cause);
  }
}
