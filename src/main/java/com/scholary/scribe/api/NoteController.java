package com.scholary.scribe.api;

import com.scholary.scribe.api.JobStatusResponse.Status;
import com.scholary.scribe.job.NoteJob;
import com.scholary.scribe.job.NoteJobRepository;
import com.scholary.scribe.job.NoteJobRunner;
import com.scholary.scribe.note.NoteExporter;
import com.scholary.scribe.note.NoteFormat;
import com.scholary.scribe.note.NoteRequest;
import com.scholary.scribe.note.NoteResult;
import com.scholary.scribe.service.ScribeOrchestrator;
import com.scholary.scribe.service.ScribeRequest;
import com.scholary.scribe.service.ScribeResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for clinical note generation.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a note job from an uploaded recording or an audio URL (returns job ID)
 *   <li>Synchronous transcription and note generation from an audio URL
 *   <li>Job status polling and cancellation
 *   <li>Downloading the finished note as markdown or plain text
 *   <li>Regenerating a note from existing transcript text
 * </ul>
 */
@RestController
@RequestMapping("/api/notes")
@Tag(name = "Notes", description = "Clinical encounter transcription and note generation API")
public class NoteController {

  private static final Logger LOGGER = LoggerFactory.getLogger(NoteController.class);
  private static final MediaType TEXT_MARKDOWN = new MediaType("text", "markdown", StandardCharsets.UTF_8);
  private static final MediaType TEXT_PLAIN_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

  private final NoteJobRepository jobRepository;
  private final NoteJobRunner jobRunner;
  private final ScribeOrchestrator orchestrator;
  private final NoteExporter noteExporter;

  public NoteController(
      NoteJobRepository jobRepository,
      NoteJobRunner jobRunner,
      ScribeOrchestrator orchestrator,
      NoteExporter noteExporter) {
    this.jobRepository = jobRepository;
    this.jobRunner = jobRunner;
    this.orchestrator = orchestrator;
    this.noteExporter = noteExporter;
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Start note job from uploaded audio",
      description = "Upload a recording, transcribe it and generate a note; returns a job ID")
  public ResponseEntity<AsyncJobResponse> createFromUpload(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "format", defaultValue = "SOAP") String format,
      @RequestParam(value = "speakerLabels", defaultValue = "true") boolean speakerLabels)
      throws IOException {
    LOGGER.info(
        "Note request: upload={}, size={}, format={}",
        file.getOriginalFilename(),
        file.getSize(),
        format);

    ScribeRequest request =
        ScribeRequest.forAudio(file.getBytes(), speakerLabels, NoteFormat.fromLabel(format));
    return start(request);
  }

  @PostMapping(value = "/from-url", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Start note job from audio URL",
      description = "Transcribe audio fetched by URL and generate a note; returns a job ID")
  public ResponseEntity<AsyncJobResponse> createFromUrl(
      @Valid @RequestBody NoteFromUrlRequest body) {
    LOGGER.info("Note request: url, format={}", body.format());
    return start(ScribeRequest.forUrl(body.audioUrl(), body.speakerLabels(), body.format()));
  }

  /**
   * Run the whole pipeline in the request thread.
   *
   * <p>Transcription failures map to error responses through {@link ApiExceptionHandler}.
   */
  @PostMapping(value = "/from-url/sync", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Transcribe and generate note synchronously",
      description = "Blocks until the transcript is ready and the note is produced")
  public ResponseEntity<ScribeResult> createFromUrlSync(
      @Valid @RequestBody NoteFromUrlRequest body) {
    LOGGER.info("Sync note request: url, format={}", body.format());
    ScribeResult result =
        orchestrator.process(
            ScribeRequest.forUrl(body.audioUrl(), body.speakerLabels(), body.format()));
    return ResponseEntity.ok(result);
  }

  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async note job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(toResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping("/jobs/{id}/cancel")
  @Operation(
      summary = "Cancel job",
      description = "Stop a pending job before it uploads, or a running job at its next status check")
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String id) {
    return jobRepository
        .requestCancellation(id)
        .map(job -> ResponseEntity.accepted().body(toResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/jobs/{id}/note.md")
  @Operation(summary = "Download note as markdown")
  public ResponseEntity<byte[]> downloadMarkdown(@PathVariable String id) {
    return jobRepository
        .findCompletedResult(id)
        .map(
            result ->
                download(
                    noteExporter.writeMarkdown(result.markdown()),
                    NoteExporter.MARKDOWN_FILENAME,
                    TEXT_MARKDOWN))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/jobs/{id}/note.txt")
  @Operation(summary = "Download note as plain text")
  public ResponseEntity<byte[]> downloadText(@PathVariable String id) {
    return jobRepository
        .findCompletedResult(id)
        .map(
            result ->
                download(
                    noteExporter.writeText(result.note().rawText(), result.markdown()),
                    NoteExporter.TEXT_FILENAME,
                    TEXT_PLAIN_UTF8))
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping(value = "/regenerate", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Regenerate note",
      description = "Produce a note from existing transcript text without transcribing again")
  public ResponseEntity<NoteResponse> regenerate(@Valid @RequestBody RegenerateRequest body) {
    NoteResult note = orchestrator.produceNote(new NoteRequest(body.transcriptText(), body.format()));
    return ResponseEntity.ok(NoteResponse.of(note, orchestrator.beautify(note)));
  }

  private ResponseEntity<AsyncJobResponse> start(ScribeRequest request) {
    NoteJob job = jobRepository.create(request);
    try {
      jobRunner.runAsync(job);
    } catch (TaskRejectedException e) {
      job.fail(Status.FAILED, e);
      jobRepository.save(job);
      throw e;
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(new AsyncJobResponse(job.getJobId()));
  }

  private static ResponseEntity<byte[]> download(byte[] body, String filename, MediaType type) {
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .contentType(type)
        .body(body);
  }

  private static JobStatusResponse toResponse(NoteJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        job.getCreatedAt(),
        job.getResult(),
        job.getError(),
        job.getErrorType());
  }
}
