package com.scholary.scribe.job;

import com.scholary.scribe.api.JobStatusResponse.Status;
import com.scholary.scribe.assemblyai.CancellationToken;
import com.scholary.scribe.service.ScribeRequest;
import com.scholary.scribe.service.ScribeResult;
import java.time.Instant;

/**
 * Represents an async note job.
 *
 * <p>Tracks the job's state and result. Stored in memory using Caffeine cache.
 */
public class NoteJob {

  private final String jobId;
  private final ScribeRequest request;
  private final Instant createdAt;
  private final CancellationToken cancellation = CancellationToken.create();

  private volatile Status status;
  private volatile ScribeResult result;
  private volatile String error;
  private volatile String errorType;

  public NoteJob(String jobId, ScribeRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public ScribeRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public CancellationToken getCancellation() {
    return cancellation;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public ScribeResult getResult() {
    return result;
  }

  public void setResult(ScribeResult result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public String getErrorType() {
    return errorType;
  }

  public void fail(Status status, Exception cause) {
    this.status = status;
    this.error = cause.getMessage();
    this.errorType = cause.getClass().getSimpleName();
  }
}
