package com.scholary.scribe.assemblyai;

/**
 * Base class for failures talking to the transcription service.
 *
 * <p>Any of these aborts the pipeline for the current request.
 */
public class TranscriptionException extends RuntimeException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
