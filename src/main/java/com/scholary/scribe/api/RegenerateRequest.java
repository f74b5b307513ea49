package com.scholary.scribe.api;

import com.scholary.scribe.note.NoteFormat;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** Request to produce a note from transcript text that already exists. */
public record RegenerateRequest(@NotBlank String transcriptText, @NotNull NoteFormat format) {}
