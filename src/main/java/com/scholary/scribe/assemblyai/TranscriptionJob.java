package com.scholary.scribe.assemblyai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Snapshot of a transcription job as returned by {@code GET /transcript/{id}}.
 *
 * <p>{@code text} is only meaningful once the job is completed and {@code error} once it has
 * failed. {@code utterances} is kept as the raw JSON array because individual records may be
 * partial; {@link com.scholary.scribe.transcript.UtteranceFormatter} normalizes them. {@code
 * payload} is the full response body, kept for display.
 */
public record TranscriptionJob(
    String id,
    JobStatus status,
    String text,
    JsonNode utterances,
    String error,
    JsonNode payload) {

  public static TranscriptionJob fromPayload(JsonNode payload) {
    return new TranscriptionJob(
        textOrNull(payload, "id"),
        JobStatus.fromWire(textOrNull(payload, "status")),
        textOrNull(payload, "text"),
        payload.has("utterances") ? payload.get("utterances") : MissingNode.getInstance(),
        textOrNull(payload, "error"),
        payload);
  }

  public String textOrEmpty() {
    return text == null ? "" : text;
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
