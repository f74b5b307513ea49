package com.scholary.scribe.assemblyai;

/** Thrown when the transcription service reports {@code status == error} for a job. */
public class JobFailedException extends TranscriptionException {

  private final String transcriptId;
  private final String detail;

  public JobFailedException(String transcriptId, String detail) {
    super(String.format("Transcription %s failed: %s", transcriptId, detail));
    this.transcriptId = transcriptId;
    this.detail = detail;
  }

  public String getTranscriptId() {
    return transcriptId;
  }

  public String getDetail() {
    return detail;
  }
}
