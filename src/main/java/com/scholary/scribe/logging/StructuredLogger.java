package com.scholary.scribe.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} field plus event-specific fields for the duration of a
 * single log statement, so they can be queried in the log store.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log transcript submitted event. */
  public void logTranscriptSubmitted(String transcriptId, boolean speakerLabels) {
    try {
      MDC.put("event_type", "transcript_submitted");
      MDC.put("transcriptId", transcriptId);
      MDC.put("speakerLabels", String.valueOf(speakerLabels));

      logger.info(
          "Transcript submitted: id={}, speakerLabels={}", transcriptId, speakerLabels);
    } finally {
      clearEventFields();
    }
  }

  /** Log a single status check of the poll loop. */
  public void logTranscriptPolled(String transcriptId, String status, int statusChecks) {
    try {
      MDC.put("event_type", "transcript_polled");
      MDC.put("transcriptId", transcriptId);
      MDC.put("status", status);
      MDC.put("statusChecks", String.valueOf(statusChecks));

      logger.debug(
          "Transcript polled: id={}, status={}, checks={}", transcriptId, status, statusChecks);
    } finally {
      clearEventFields();
    }
  }

  /** Log a generation candidate that was skipped. */
  public void logCandidateFailed(String model, String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "candidate_failed");
      MDC.put("model", model);
      MDC.put("stage", stage);
      MDC.put("errorType", errorType);

      logger.debug(
          "Candidate failed: model={}, stage={}, error={}, message={}",
          model,
          stage,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log note produced event. */
  public void logNoteProduced(String format, String producingModel, int attempts, int chars) {
    try {
      MDC.put("event_type", "note_produced");
      MDC.put("format", format);
      MDC.put("model", producingModel);
      MDC.put("attempts", String.valueOf(attempts));
      MDC.put("chars", String.valueOf(chars));

      logger.info(
          "Note produced: format={}, model={}, attempts={}, chars={}",
          format,
          producingModel,
          attempts,
          chars);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String format) {
    MDC.put("jobId", jobId);
    MDC.put("noteFormat", format);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("noteFormat");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("transcriptId");
    MDC.remove("speakerLabels");
    MDC.remove("status");
    MDC.remove("statusChecks");
    MDC.remove("model");
    MDC.remove("stage");
    MDC.remove("errorType");
    MDC.remove("format");
    MDC.remove("attempts");
    MDC.remove("chars");
  }
}
