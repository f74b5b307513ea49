package com.scholary.scribe.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.scribe.note.NoteResult;
import com.scholary.scribe.transcript.Utterance;
import java.util.List;

/**
 * Result of a pipeline run.
 *
 * <p>Contains the transcript, the note in raw and markdown form, and the transcription service
 * payload as received.
 */
public record ScribeResult(
    String transcriptId,
    String transcriptText,
    List<Utterance> utterances,
    NoteResult note,
    String markdown,
    JsonNode transcriptPayload) {}
