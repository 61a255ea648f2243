package com.scholary.streamvault.extractor;

import com.scholary.streamvault.error.DownloadException;
import com.scholary.streamvault.error.ErrorKind;

/**
 * Thrown when the extractor cannot resolve a source.
 *
 * <p>Kind is NOT_FOUND or UNSUPPORTED for permanent problems with the input and EXTRACT_ERROR for
 * everything else (network, tool failures, timeouts).
 */
public class ExtractorException extends DownloadException {

  public ExtractorException(ErrorKind kind, String message) {
    super(kind, message);
  }

  public ExtractorException(ErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }

  /** Permanent failures are not worth another attempt. */
  public boolean isRetryable() {
    return getKind() == ErrorKind.EXTRACT_ERROR;
  }
}
