package com.scholary.scribe.assemblyai;

/**
 * Thrown on a non-2xx response, a network failure or an unreadable response body.
 *
 * <p>{@link #getStatusCode()} is -1 when no HTTP response was received.
 */
public class TransportException extends TranscriptionException {

  private final int statusCode;

  public TransportException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
