package com.scholary.scribe.note;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Clinical note formats.
 *
 * <p>Each format owns its title line, its section labels and the name of its prompt template, so
 * the prompt, the template fallback and the beautifier all read the same definition.
 */
public enum NoteFormat {
  SOAP(
      "SOAP",
      "soap",
      "SOAP NOTE",
      List.of("S – Subjective", "O – Objective", "A – Assessment", "P – Plan")),
  HP(
      "H&P",
      "hp",
      "HISTORY & PHYSICAL (H&P)",
      List.of("HISTORY", "PHYSICAL EXAM", "ASSESSMENT", "PLAN"));

  private final String label;
  private final String templateName;
  private final String title;
  private final List<String> sectionLabels;

  NoteFormat(String label, String templateName, String title, List<String> sectionLabels) {
    this.label = label;
    this.templateName = templateName;
    this.title = title;
    this.sectionLabels = sectionLabels;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public String templateName() {
    return templateName;
  }

  public String title() {
    return title;
  }

  public List<String> sectionLabels() {
    return sectionLabels;
  }

  /** Section label at {@code index}, in template order. */
  public String section(int index) {
    return sectionLabels.get(index);
  }

  /**
   * Parse a user-facing label. Accepts {@code SOAP}, {@code H&P} and {@code HP}, ignoring case.
   *
   * @throws IllegalArgumentException for anything else
   */
  @JsonCreator
  public static NoteFormat fromLabel(String value) {
    if (value != null) {
      String normalized = value.trim().toUpperCase(Locale.ROOT);
      for (NoteFormat format : values()) {
        if (format.label.equals(normalized) || format.name().equals(normalized)) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Unknown note format: " + value);
  }
}
