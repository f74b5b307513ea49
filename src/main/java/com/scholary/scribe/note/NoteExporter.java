package com.scholary.scribe.note;

import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/**
 * Writes a note as downloadable documents.
 *
 * <p>Supports markdown (the beautified note) and plain text (the raw note). Both are UTF-8 with no
 * further encoding.
 */
@Component
public class NoteExporter {

  public static final String MARKDOWN_FILENAME = "note.md";
  public static final String TEXT_FILENAME = "note.txt";

  public byte[] writeMarkdown(String markdown) {
    return (markdown == null ? "" : markdown).getBytes(StandardCharsets.UTF_8);
  }

  /** Raw note text, or the markdown when there is no raw text. */
  public byte[] writeText(String rawText, String markdown) {
    if (rawText == null || rawText.isEmpty()) {
      return writeMarkdown(markdown);
    }
    return rawText.getBytes(StandardCharsets.UTF_8);
  }
}
