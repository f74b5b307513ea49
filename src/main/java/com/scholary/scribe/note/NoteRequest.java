package com.scholary.scribe.note;

/** Transcript text to summarize and the note format to produce. */
public record NoteRequest(String transcriptText, NoteFormat format) {

  public NoteRequest {
    if (format == null) {
      throw new IllegalArgumentException("format is required");
    }
    if (transcriptText == null) {
      transcriptText = "";
    }
  }
}
