package com.scholary.scribe.assemblyai;

/**
 * Status of a transcription job as reported by the service.
 *
 * <p>Only {@link #COMPLETED} and {@link #ERROR} are terminal. Status strings the client does not
 * recognize map to {@link #UNKNOWN}, which is polled like {@link #PROCESSING}.
 */
public enum JobStatus {
  QUEUED("queued"),
  PROCESSING("processing"),
  COMPLETED("completed"),
  ERROR("error"),
  UNKNOWN("unknown");

  private final String wireValue;

  JobStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  public static JobStatus fromWire(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    for (JobStatus status : values()) {
      if (status != UNKNOWN && status.wireValue.equals(value)) {
        return status;
      }
    }
    return UNKNOWN;
  }
}
