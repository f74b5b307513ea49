package com.scholary.scribe.generation;

/** Text produced by a model, with the identifier of the model that produced it. */
public record GeneratedText(String text, String modelId) {

  public boolean isBlank() {
    return text == null || text.isBlank();
  }
}
