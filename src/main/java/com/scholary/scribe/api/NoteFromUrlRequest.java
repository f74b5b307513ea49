package com.scholary.scribe.api;

import com.scholary.scribe.note.NoteFormat;
import jakarta.validation.constraints.NotBlank;

/**
 * Request for a note from audio the transcription service can fetch by URL.
 *
 * <p>Speaker labels default to on and the format defaults to SOAP.
 */
public record NoteFromUrlRequest(@NotBlank String audioUrl, NoteFormat format, Boolean speakerLabels) {

  public NoteFromUrlRequest {
    if (format == null) {
      format = NoteFormat.SOAP;
    }
    if (speakerLabels == null) {
      speakerLabels = true;
    }
  }
}
