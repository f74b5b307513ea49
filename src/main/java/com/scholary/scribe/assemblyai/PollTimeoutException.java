package com.scholary.scribe.assemblyai;

import java.time.Duration;

/** Thrown when a job has not reached a terminal status within the configured poll duration. */
public class PollTimeoutException extends TranscriptionException {

  private final String transcriptId;
  private final int statusChecks;

  public PollTimeoutException(String transcriptId, Duration maxPollDuration, int statusChecks) {
    super(
        String.format(
            "Transcription %s not finished after %ds (%d status checks)",
            transcriptId, maxPollDuration.toSeconds(), statusChecks));
    this.transcriptId = transcriptId;
    this.statusChecks = statusChecks;
  }

  public String getTranscriptId() {
    return transcriptId;
  }

  public int getStatusChecks() {
    return statusChecks;
  }
}
