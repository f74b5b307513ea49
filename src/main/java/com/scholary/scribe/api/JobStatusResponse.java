package com.scholary.scribe.api;

import com.scholary.scribe.service.ScribeResult;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async note job and includes the result if completed, or the
 * error and its type if not.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    Instant createdAt,
    ScribeResult result,
    String error,
    String errorType) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    TIMED_OUT,
    CANCELLED;

    public boolean isFinished() {
      return this != PENDING && this != PROCESSING;
    }
  }
}
