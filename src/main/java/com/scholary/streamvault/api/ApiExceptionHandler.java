package com.scholary.streamvault.api;

import com.scholary.streamvault.error.DownloadException;
import com.scholary.streamvault.error.ErrorKind;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps failures to {@link ErrorResponse} bodies with a status per {@link ErrorKind}. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(DownloadException.class)
  public ResponseEntity<ErrorResponse> handleDownloadException(DownloadException e) {
    HttpStatus status = statusFor(e.getKind());
    if (status.is5xxServerError()) {
      LOGGER.error("Request failed: kind={}, message={}", e.getKind(), e.getMessage(), e);
    } else {
      LOGGER.info("Request rejected: kind={}, message={}", e.getKind(), e.getMessage());
    }
    return ResponseEntity.status(status).body(new ErrorResponse(e.getKind(), e.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ResponseEntity.badRequest()
        .body(new ErrorResponse(ErrorKind.INVALID_REQUEST, message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    String message = "Malformed request: " + e.getMostSpecificCause().getMessage();
    return ResponseEntity.badRequest().body(new ErrorResponse(ErrorKind.INVALID_REQUEST, message));
  }

  static HttpStatus statusFor(ErrorKind kind) {
    return switch (kind) {
      case INVALID_URL, INVALID_REQUEST, INVALID_TIME -> HttpStatus.BAD_REQUEST;
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case UNSUPPORTED -> HttpStatus.UNPROCESSABLE_ENTITY;
      case INVALID_STATE, CANCELLED -> HttpStatus.CONFLICT;
      case EXTRACT_ERROR -> HttpStatus.BAD_GATEWAY;
      case STORE_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }
}
