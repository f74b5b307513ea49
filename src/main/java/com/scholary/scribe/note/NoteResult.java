package com.scholary.scribe.note;

import com.scholary.scribe.generation.CandidateAttempt;
import java.util.List;

/**
 * A produced note and where it came from.
 *
 * <p>{@code producingModel} is the model identifier that generated {@code rawText}, or {@value
 * #TEMPLATE_FALLBACK} when the note came from {@link TemplateFallbackBuilder}. {@code attempts}
 * lists the generation candidates tried, empty when generation was skipped.
 */
public record NoteResult(
    String rawText, NoteFormat format, String producingModel, List<CandidateAttempt> attempts) {

  public static final String TEMPLATE_FALLBACK = "template-fallback";

  public NoteResult {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  public static NoteResult fromTemplate(
      String rawText, NoteFormat format, List<CandidateAttempt> attempts) {
    return new NoteResult(rawText, format, TEMPLATE_FALLBACK, attempts);
  }

  public boolean isTemplateFallback() {
    return TEMPLATE_FALLBACK.equals(producingModel);
  }
}
