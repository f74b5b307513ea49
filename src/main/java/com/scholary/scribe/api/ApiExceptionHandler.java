package com.scholary.scribe.api;

import com.scholary.scribe.assemblyai.JobFailedException;
import com.scholary.scribe.assemblyai.PollCancelledException;
import com.scholary.scribe.assemblyai.PollTimeoutException;
import com.scholary.scribe.assemblyai.TransportException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Converts exceptions at the REST boundary to HTTP responses.
 *
 * <p>Transcription failures keep their distinct outcomes: transport errors are 502, a job the
 * service failed is 422, a poll timeout is 504 and a cancelled poll is 409. A full job queue is
 * 503.
 */
@RestControllerAdvice
class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(TransportException.class)
  ResponseEntity<ApiError> handleTransport(TransportException ex) {
    LOGGER.error("Transcription service call failed: status={}", ex.getStatusCode(), ex);
    return error(HttpStatus.BAD_GATEWAY, ex, "Transcription service request failed");
  }

  @ExceptionHandler(JobFailedException.class)
  ResponseEntity<ApiError> handleJobFailed(JobFailedException ex) {
    LOGGER.warn("Transcription job {} failed: {}", ex.getTranscriptId(), ex.getDetail());
    return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, ex.getDetail());
  }

  @ExceptionHandler(PollTimeoutException.class)
  ResponseEntity<ApiError> handleTimeout(PollTimeoutException ex) {
    LOGGER.warn(ex.getMessage());
    return error(HttpStatus.GATEWAY_TIMEOUT, ex, ex.getMessage());
  }

  @ExceptionHandler(PollCancelledException.class)
  ResponseEntity<ApiError> handleCancelled(PollCancelledException ex) {
    LOGGER.info(ex.getMessage());
    return error(HttpStatus.CONFLICT, ex, ex.getMessage());
  }

  @ExceptionHandler(TaskRejectedException.class)
  ResponseEntity<ApiError> handleRejected(TaskRejectedException ex) {
    LOGGER.warn("Note job queue is full: {}", ex.getMessage());
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, ex, "Too many note jobs in progress, try again later");
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MethodArgumentNotValidException.class,
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class,
    MultipartException.class
  })
  ResponseEntity<ApiError> handleBadRequest(Exception ex) {
    LOGGER.warn("Invalid request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex, ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiError(
                "InternalServerError", "An unexpected error occurred", Instant.now()));
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message) {
    return ResponseEntity.status(status)
        .body(new ApiError(ex.getClass().getSimpleName(), message, Instant.now()));
  }

  /** Standardized error response for API clients. */
  record ApiError(String errorCode, String message, Instant timestamp) {}
}
