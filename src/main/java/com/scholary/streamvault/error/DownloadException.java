package com.scholary.streamvault.error;

/**
 * Base exception for orchestrator failures.
 *
 * <p>Runtime exception because callers rarely recover locally: the API layer maps the kind to a
 * response, and workers record the message on the job.
 */
public class DownloadException extends RuntimeException {

  private final ErrorKind kind;

  public DownloadException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public DownloadException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public static DownloadException invalidUrl(String message) {
    return new DownloadException(ErrorKind.INVALID_URL, message);
  }

  public static DownloadException invalidRequest(String message) {
    return new DownloadException(ErrorKind.INVALID_REQUEST, message);
  }

  public static DownloadException notFound(String message) {
    return new DownloadException(ErrorKind.NOT_FOUND, message);
  }

  public static DownloadException invalidState(String message) {
    return new DownloadException(ErrorKind.INVALID_STATE, message);
  }

  public static DownloadException invalidTime(String message) {
    return new DownloadException(ErrorKind.INVALID_TIME, message);
  }
}
