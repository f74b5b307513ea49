package com.scholary.scribe.generation;

/** A generation backend bound to one model identifier. */
public interface GenerativeModel {

  /** Count tokens for {@code text}; used with empty text as a cheap availability probe. */
  int countTokens(String text);

  /** Generate text for {@code prompt}. May return null or blank. */
  String generateContent(String prompt);
}
