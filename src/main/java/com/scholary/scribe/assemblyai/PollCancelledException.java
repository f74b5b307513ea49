package com.scholary.scribe.assemblyai;

/**
 * Thrown when a transcription run stops because the caller cancelled or the polling thread was
 * interrupted.
 *
 * <p>The transcript id is null when cancellation was seen before a job was submitted.
 */
public class PollCancelledException extends TranscriptionException {

  private final String transcriptId;

  public PollCancelledException(String transcriptId) {
    this(transcriptId, "Polling cancelled for transcription " + transcriptId);
  }

  private PollCancelledException(String transcriptId, String message) {
    super(message);
    this.transcriptId = transcriptId;
  }

  /** Cancellation seen before {@code step}, so no transcription job exists yet. */
  public static PollCancelledException before(String step) {
    return new PollCancelledException(null, "Cancelled before " + step);
  }

  public String getTranscriptId() {
    return transcriptId;
  }
}
