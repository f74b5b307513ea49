package com.scholary.scribe.service;

import com.scholary.scribe.assemblyai.CancellationToken;
import com.scholary.scribe.assemblyai.PollCancelledException;
import com.scholary.scribe.assemblyai.TranscriptionJob;
import com.scholary.scribe.assemblyai.TranscriptionService;
import com.scholary.scribe.generation.CandidateAttempt;
import com.scholary.scribe.generation.SelectionResult;
import com.scholary.scribe.logging.StructuredLogger;
import com.scholary.scribe.note.NoteBeautifier;
import com.scholary.scribe.note.NoteFormat;
import com.scholary.scribe.note.NoteGenerator;
import com.scholary.scribe.note.NoteRequest;
import com.scholary.scribe.note.NoteResult;
import com.scholary.scribe.note.TemplateFallbackBuilder;
import com.scholary.scribe.transcript.Utterance;
import com.scholary.scribe.transcript.UtteranceFormatter;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs the pipeline: upload, submit, poll, format utterances, produce a note, beautify.
 *
 * <p>Failures in upload, submit or poll propagate and no partial result is returned. A cancelled
 * token is checked before the upload and before the submit, so a run cancelled while queued makes
 * no billed call.
 *
 * <p>Note generation never fails the pipeline: when no model produces text, the note comes from
 * the {@link TemplateFallbackBuilder}.
 */
@Service
public class ScribeOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScribeOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final TranscriptionService transcriptionService;
  private final UtteranceFormatter utteranceFormatter;
  private final NoteGenerator noteGenerator;
  private final TemplateFallbackBuilder templateFallbackBuilder;
  private final NoteBeautifier noteBeautifier;

  public ScribeOrchestrator(
      TranscriptionService transcriptionService,
      UtteranceFormatter utteranceFormatter,
      NoteGenerator noteGenerator,
      TemplateFallbackBuilder templateFallbackBuilder,
      NoteBeautifier noteBeautifier) {
    this.transcriptionService = transcriptionService;
    this.utteranceFormatter = utteranceFormatter;
    this.noteGenerator = noteGenerator;
    this.templateFallbackBuilder = templateFallbackBuilder;
    this.noteBeautifier = noteBeautifier;
  }

  public ScribeResult process(ScribeRequest request) {
    return process(request, CancellationToken.create());
  }

  public ScribeResult process(ScribeRequest request, CancellationToken cancellation) {
    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);

    try {
      LOGGER.info(
          "Starting scribe run: source={}, speakerLabels={}, format={}",
          request.hasLocalAudio() ? "upload" : "url",
          request.speakerLabels(),
          request.format());

      String audioUrl = request.audioUrl();
      if (request.hasLocalAudio()) {
        ensureNotCancelled(cancellation, "upload");
        audioUrl = transcriptionService.upload(request.audio());
      }

      ensureNotCancelled(cancellation, "submit");
      String transcriptId = transcriptionService.submit(audioUrl, request.speakerLabels());
      TranscriptionJob job = transcriptionService.poll(transcriptId, cancellation);

      List<Utterance> utterances = utteranceFormatter.format(job);
      String transcriptText = job.textOrEmpty();
      LOGGER.info(
          "Transcript ready: id={}, utterances={}, chars={}",
          transcriptId,
          utterances.size(),
          transcriptText.length());

      NoteResult note = produceNote(new NoteRequest(transcriptText, request.format()));
      String markdown = noteBeautifier.beautify(note.rawText());

      return new ScribeResult(
          transcriptId, transcriptText, utterances, note, markdown, job.payload());
    } finally {
      MDC.remove("correlationId");
    }
  }

  private static void ensureNotCancelled(CancellationToken cancellation, String step) {
    if (cancellation.isCancelled()) {
      LOGGER.info("Run cancelled before {}", step);
      throw PollCancelledException.before(step);
    }
  }

  /**
   * Produce a note for transcript text that already exists.
   *
   * <p>Generation is attempted only when a credential is configured and the text is not blank.
   */
  public NoteResult produceNote(NoteRequest request) {
    String transcriptText = request.transcriptText();
    NoteFormat format = request.format();
    List<CandidateAttempt> attempts = List.of();

    if (noteGenerator.isConfigured() && !transcriptText.isBlank()) {
      SelectionResult selection = noteGenerator.generate(transcriptText, format);
      attempts = selection.attempts();
      if (selection.generatedText().filter(g -> !g.isBlank()).isPresent()) {
        NoteResult note =
            new NoteResult(
                selection.generated().text(), format, selection.generated().modelId(), attempts);
        structuredLogger.logNoteProduced(
            format.label(), note.producingModel(), attempts.size(), note.rawText().length());
        return note;
      }
      LOGGER.info("No usable generated text, using template fallback");
    }

    NoteResult note =
        NoteResult.fromTemplate(
            templateFallbackBuilder.build(transcriptText, format), format, attempts);
    structuredLogger.logNoteProduced(
        format.label(), note.producingModel(), attempts.size(), note.rawText().length());
    return note;
  }

  /** Markdown form of a note, for callers that only have the raw text. */
  public String beautify(NoteResult note) {
    return noteBeautifier.beautify(note.rawText());
  }
}
