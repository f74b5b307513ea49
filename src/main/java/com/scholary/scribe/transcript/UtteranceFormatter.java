package com.scholary.scribe.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.scribe.assemblyai.TranscriptionJob;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Normalizes raw diarization records into {@link Utterance}s.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>Each diarized record maps to exactly one utterance, in emission order. A missing speaker
 *       becomes {@value #UNKNOWN_SPEAKER}, missing text becomes empty, and millisecond timestamps
 *       that are absent or not numeric become 0.
 *   <li>Without diarized records, non-blank flat text becomes a single utterance spoken by
 *       {@value #GENERIC_SPEAKER} at time 0.
 *   <li>Otherwise the result is empty.
 * </ul>
 *
 * <p>Never throws for any JSON shape.
 */
@Component
public class UtteranceFormatter {

  public static final String UNKNOWN_SPEAKER = "Unknown";
  public static final String GENERIC_SPEAKER = "Speaker";

  public List<Utterance> format(TranscriptionJob job) {
    return format(job.utterances(), job.text());
  }

  public List<Utterance> format(JsonNode records, String fullText) {
    List<Utterance> utterances = new ArrayList<>();

    if (records != null && records.isArray() && !records.isEmpty()) {
      for (JsonNode record : records) {
        utterances.add(toUtterance(record));
      }
      return utterances;
    }

    if (fullText != null && !fullText.isBlank()) {
      utterances.add(new Utterance(GENERIC_SPEAKER, fullText, 0, 0));
    }
    return utterances;
  }

  private Utterance toUtterance(JsonNode record) {
    JsonNode speaker = record.get("speaker");
    JsonNode text = record.get("text");
    return new Utterance(
        speaker == null || speaker.isNull() ? UNKNOWN_SPEAKER : speaker.asText(),
        text == null || text.isNull() ? "" : text.asText(),
        millisToSeconds(record.get("start")),
        millisToSeconds(record.get("end")));
  }

  static double millisToSeconds(JsonNode value) {
    if (value == null || !value.isNumber()) {
      return 0;
    }
    return value.asDouble() / 1000.0;
  }
}
