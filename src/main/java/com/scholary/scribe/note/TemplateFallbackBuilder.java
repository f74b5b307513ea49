package com.scholary.scribe.note;

import org.springframework.stereotype.Component;

/**
 * Builds a note in the same layout as the generation prompts without calling any model.
 *
 * <p>Every field reads {@value #NOT_MENTIONED} except History of Present Illness, which carries
 * the trimmed transcript text when there is any. Pure and total.
 */
@Component
public class TemplateFallbackBuilder {

  public static final String NOT_MENTIONED = "Not mentioned.";

  public String build(String transcriptText, NoteFormat format) {
    String trimmed = transcriptText == null ? "" : transcriptText.strip();
    String presentIllness = trimmed.isEmpty() ? NOT_MENTIONED : trimmed;

    switch (format) {
      case SOAP:
        return soap(presentIllness);
      case HP:
        return historyAndPhysical(presentIllness);
      default:
        throw new IllegalArgumentException("Unsupported note format: " + format);
    }
  }

  private static String soap(String presentIllness) {
    NoteFormat f = NoteFormat.SOAP;
    StringBuilder note = new StringBuilder();
    note.append(f.title()).append('\n');
    header(note);
    note.append('\n');

    note.append(f.section(0)).append('\n');
    bullet(note, "Chief Complaint", NOT_MENTIONED);
    bullet(note, "History of Present Illness", presentIllness);
    bullet(note, "Review of Systems (only items mentioned)", NOT_MENTIONED);
    bullet(note, "Past Medical History", NOT_MENTIONED);
    bullet(note, "Medications", NOT_MENTIONED);
    bullet(note, "Allergies", NOT_MENTIONED);
    bullet(note, "Family History", NOT_MENTIONED);
    bullet(note, "Social History", NOT_MENTIONED);
    note.append('\n');

    note.append(f.section(1)).append('\n');
    note.append("• Exam findings from transcript\n");
    note.append("No physical exam performed; assessment based on verbal report.\n");
    note.append("• Vitals if mentioned\n");
    note.append(NOT_MENTIONED).append('\n');
    note.append('\n');

    note.append(f.section(2)).append('\n');
    note.append("• ").append(NOT_MENTIONED).append('\n');
    note.append('\n');

    note.append(f.section(3)).append('\n');
    note.append("• ").append(NOT_MENTIONED).append('\n');
    return note.toString();
  }

  private static String historyAndPhysical(String presentIllness) {
    NoteFormat f = NoteFormat.HP;
    StringBuilder note = new StringBuilder();
    note.append(f.title()).append("\n\n");
    header(note);
    note.append('\n');

    note.append(f.section(0)).append('\n');
    field(note, "Chief Complaint", NOT_MENTIONED);
    field(note, "History of Present Illness", presentIllness);
    field(note, "Past Medical History", NOT_MENTIONED);
    field(note, "Past Surgical History", NOT_MENTIONED);
    field(note, "Medications", NOT_MENTIONED);
    field(note, "Allergies", NOT_MENTIONED);
    field(note, "Family History", NOT_MENTIONED);
    field(note, "Social History", NOT_MENTIONED);
    field(note, "Review of Systems", NOT_MENTIONED);
    note.append('\n');

    note.append(f.section(1)).append('\n');
    note.append("• Not performed in transcript.\n");
    note.append('\n');

    note.append(f.section(2)).append('\n');
    note.append("• ").append(NOT_MENTIONED).append('\n');
    note.append('\n');

    note.append(f.section(3)).append('\n');
    note.append("• ").append(NOT_MENTIONED).append('\n');
    return note.toString();
  }

  private static void header(StringBuilder note) {
    field(note, "Patient Name", NOT_MENTIONED);
    field(note, "DOB", NOT_MENTIONED);
    field(note, "Clinician", NOT_MENTIONED);
    field(note, "Date", NOT_MENTIONED);
    field(note, "Setting", NOT_MENTIONED);
  }

  private static void field(StringBuilder note, String label, String value) {
    note.append(label).append(": ").append(value).append('\n');
  }

  private static void bullet(StringBuilder note, String label, String value) {
    note.append("• ");
    field(note, label, value);
  }
}
