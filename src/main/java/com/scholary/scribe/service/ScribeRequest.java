package com.scholary.scribe.service;

import com.scholary.scribe.note.NoteFormat;

/**
 * Request for one pass of the pipeline.
 *
 * <p>Exactly one audio source is set: local bytes, which are uploaded first, or a URL the
 * transcription service can fetch itself.
 */
public record ScribeRequest(
    byte[] audio, String audioUrl, boolean speakerLabels, NoteFormat format) {

  public ScribeRequest {
    boolean hasAudio = audio != null && audio.length > 0;
    boolean hasUrl = audioUrl != null && !audioUrl.isBlank();
    if (hasAudio == hasUrl) {
      throw new IllegalArgumentException("Exactly one of audio bytes or audio URL is required");
    }
    if (format == null) {
      throw new IllegalArgumentException("format is required");
    }
  }

  public static ScribeRequest forAudio(byte[] audio, boolean speakerLabels, NoteFormat format) {
    return new ScribeRequest(audio, null, speakerLabels, format);
  }

  public static ScribeRequest forUrl(String audioUrl, boolean speakerLabels, NoteFormat format) {
    return new ScribeRequest(null, audioUrl, speakerLabels, format);
  }

  public boolean hasLocalAudio() {
    return audio != null;
  }
}
