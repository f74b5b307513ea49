package com.scholary.scribe.note;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns flat note text into markdown for display.
 *
 * <p>Works one line at a time with no state carried between lines. Each line is trimmed, then:
 *
 * <ul>
 *   <li>blank lines stay blank
 *   <li>a note title becomes a {@code #} heading
 *   <li>a section label becomes a {@code ##} heading
 *   <li>a line ending in {@code :} that is not a bullet becomes bold
 *   <li>anything else is left as is
 * </ul>
 *
 * <p>Lines are joined with a blank line between them so markdown renders each as its own
 * paragraph. Titles and section labels come from {@link NoteFormat}.
 */
@Component
public class NoteBeautifier {

  static final String BULLET = "•";

  private final Set<String> titles = new LinkedHashSet<>();
  private final Set<String> sectionLabels = new LinkedHashSet<>();

  public NoteBeautifier() {
    this(EnumSet.allOf(NoteFormat.class));
  }

  public NoteBeautifier(Set<NoteFormat> formats) {
    for (NoteFormat format : formats) {
      titles.add(format.title());
      sectionLabels.addAll(format.sectionLabels());
    }
  }

  public String beautify(String noteText) {
    if (noteText == null || noteText.isEmpty()) {
      return "";
    }

    List<String> out = new ArrayList<>();
    for (String raw : noteText.split("\\R", -1)) {
      out.add(beautifyLine(raw));
    }
    // a trailing line terminator does not start another line
    if (!out.isEmpty() && out.get(out.size() - 1).isEmpty() && endsWithLineBreak(noteText)) {
      out.remove(out.size() - 1);
    }
    return String.join("\n\n", out);
  }

  String beautifyLine(String raw) {
    String line = raw.strip();
    if (line.isEmpty()) {
      return "";
    }
    if (titles.contains(line)) {
      return "# " + line;
    }
    if (sectionLabels.contains(line)) {
      return "## " + line;
    }
    if (line.endsWith(":") && !line.startsWith(BULLET)) {
      return "**" + line + "**";
    }
    return line;
  }

  private static boolean endsWithLineBreak(String text) {
    char last = text.charAt(text.length() - 1);
    return last == '\n' || last == '\r';
  }
}
