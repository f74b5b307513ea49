package com.scholary.scribe.generation;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a fallback selection: the generated text, if any candidate succeeded, plus every
 * attempt in the order it was made.
 */
public record SelectionResult(GeneratedText generated, List<CandidateAttempt> attempts) {

  public SelectionResult {
    attempts = List.copyOf(attempts);
  }

  public static SelectionResult exhausted(List<CandidateAttempt> attempts) {
    return new SelectionResult(null, attempts);
  }

  public Optional<GeneratedText> generatedText() {
    return Optional.ofNullable(generated);
  }

  public boolean isEmpty() {
    return generated == null;
  }
}
