package com.scholary.scribe.api;

import com.scholary.scribe.generation.CandidateAttempt;
import com.scholary.scribe.note.NoteFormat;
import com.scholary.scribe.note.NoteResult;
import java.util.List;

/** A note in raw and markdown form, with the model that produced it. */
public record NoteResponse(
    NoteFormat format,
    String rawText,
    String markdown,
    String producingModel,
    List<CandidateAttempt> attempts) {

  public static NoteResponse of(NoteResult note, String markdown) {
    return new NoteResponse(
        note.format(), note.rawText(), markdown, note.producingModel(), note.attempts());
  }
}
