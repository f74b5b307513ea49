package com.scholary.scribe.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.scribe.api.JobStatusResponse.Status;
import com.scholary.scribe.assemblyai.JobFailedException;
import com.scholary.scribe.assemblyai.TransportException;
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
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NoteController.class)
@Import(NoteExporter.class)
class NoteControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private NoteJobRepository jobRepository;
  @MockBean private NoteJobRunner jobRunner;
  @MockBean private ScribeOrchestrator orchestrator;

  @Test
  void createFromUpload_shouldStartJob() throws Exception {
    stubCreate();
    MockMultipartFile file =
        new MockMultipartFile("file", "visit.wav", "audio/wav", new byte[] {1, 2, 3});

    mockMvc
        .perform(multipart("/api/notes").file(file).param("format", "H&P"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-new"));

    ArgumentCaptor<NoteJob> captor = ArgumentCaptor.forClass(NoteJob.class);
    verify(jobRunner).runAsync(captor.capture());
    ScribeRequest request = captor.getValue().getRequest();
    assertThat(request.hasLocalAudio()).isTrue();
    assertThat(request.format()).isEqualTo(NoteFormat.HP);
    assertThat(request.speakerLabels()).isTrue();
  }

  @Test
  void createFromUpload_shouldRejectUnknownFormat() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "visit.wav", "audio/wav", new byte[] {1});

    mockMvc
        .perform(multipart("/api/notes").file(file).param("format", "DAP"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("IllegalArgumentException"));

    verify(jobRepository, never()).create(any());
    verify(jobRunner, never()).runAsync(any());
  }

  @Test
  void createFromUrl_shouldApplyDefaults() throws Exception {
    stubCreate();
    mockMvc
        .perform(
            post("/api/notes/from-url")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"audioUrl\":\"https://cdn.test/a.mp3\"}"))
        .andExpect(status().isAccepted());

    ArgumentCaptor<NoteJob> captor = ArgumentCaptor.forClass(NoteJob.class);
    verify(jobRunner).runAsync(captor.capture());
    ScribeRequest request = captor.getValue().getRequest();
    assertThat(request.audioUrl()).isEqualTo("https://cdn.test/a.mp3");
    assertThat(request.format()).isEqualTo(NoteFormat.SOAP);
    assertThat(request.speakerLabels()).isTrue();
  }

  @Test
  void createFromUrl_shouldFailJobWhenQueueIsFull() throws Exception {
    stubCreate();
    doThrow(new TaskRejectedException("queue full")).when(jobRunner).runAsync(any());

    mockMvc
        .perform(
            post("/api/notes/from-url")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"audioUrl\":\"https://cdn.test/a.mp3\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.errorCode").value("TaskRejectedException"));

    ArgumentCaptor<NoteJob> captor = ArgumentCaptor.forClass(NoteJob.class);
    verify(jobRepository).save(captor.capture());
    assertThat(captor.getValue().getStatus()).isEqualTo(Status.FAILED);
  }

  @Test
  void createFromUrl_shouldRejectMissingUrl() throws Exception {
    mockMvc
        .perform(
            post("/api/notes/from-url")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"format\":\"SOAP\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void createFromUrlSync_shouldMapTransportErrorToBadGateway() throws Exception {
    when(orchestrator.process(any(ScribeRequest.class)))
        .thenThrow(new TransportException("AssemblyAI submit returned status 401", 401));

    mockMvc
        .perform(
            post("/api/notes/from-url/sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"audioUrl\":\"https://cdn.test/a.mp3\",\"format\":\"HP\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.errorCode").value("TransportException"));
  }

  @Test
  void createFromUrlSync_shouldMapJobFailureToUnprocessable() throws Exception {
    when(orchestrator.process(any(ScribeRequest.class)))
        .thenThrow(new JobFailedException("tx-1", "Audio file is empty"));

    mockMvc
        .perform(
            post("/api/notes/from-url/sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"audioUrl\":\"https://cdn.test/a.mp3\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.message").value("Audio file is empty"));
  }

  @Test
  void getJobStatus_shouldReturnNotFoundForUnknownJob() throws Exception {
    when(jobRepository.findById("missing")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/notes/jobs/missing")).andExpect(status().isNotFound());
  }

  @Test
  void getJobStatus_shouldReportCompletedJob() throws Exception {
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(completedJob()));

    mockMvc
        .perform(get("/api/notes/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.result.transcriptId").value("tx-1"))
        .andExpect(jsonPath("$.result.note.producingModel").value("gemini-2.5-flash"))
        .andExpect(jsonPath("$.result.note.format").value("SOAP"));
  }

  @Test
  void cancel_shouldReturnJobState() throws Exception {
    NoteJob job = new NoteJob("job-2", ScribeRequest.forUrl("https://cdn.test/a", true, NoteFormat.SOAP));
    job.setStatus(Status.PROCESSING);
    when(jobRepository.requestCancellation("job-2")).thenReturn(Optional.of(job));

    mockMvc
        .perform(post("/api/notes/jobs/job-2/cancel"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-2"))
        .andExpect(jsonPath("$.status").value("PROCESSING"));
  }

  @Test
  void cancel_shouldReturnNotFoundForUnknownJob() throws Exception {
    when(jobRepository.requestCancellation("missing")).thenReturn(Optional.empty());

    mockMvc.perform(post("/api/notes/jobs/missing/cancel")).andExpect(status().isNotFound());
  }

  @Test
  void downloadMarkdown_shouldReturnAttachment() throws Exception {
    when(jobRepository.findCompletedResult("job-1"))
        .thenReturn(Optional.of(completedJob().getResult()));

    mockMvc
        .perform(get("/api/notes/jobs/job-1/note.md"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Disposition", "attachment; filename=\"note.md\""))
        .andExpect(content().string("# SOAP NOTE\n\n## S – Subjective"));
  }

  @Test
  void downloadText_shouldReturnRawNote() throws Exception {
    when(jobRepository.findCompletedResult("job-1"))
        .thenReturn(Optional.of(completedJob().getResult()));

    mockMvc
        .perform(get("/api/notes/jobs/job-1/note.txt"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Disposition", "attachment; filename=\"note.txt\""))
        .andExpect(content().string("SOAP NOTE\nS – Subjective\n"));
  }

  @Test
  void download_shouldReturnNotFoundUntilJobCompletes() throws Exception {
    when(jobRepository.findCompletedResult("job-3")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/notes/jobs/job-3/note.md")).andExpect(status().isNotFound());
  }

  @Test
  void regenerate_shouldProduceNoteWithoutTranscribing() throws Exception {
    NoteResult note = NoteResult.fromTemplate("HISTORY & PHYSICAL (H&P)\n", NoteFormat.HP, List.of());
    when(orchestrator.produceNote(new NoteRequest("Knee pain.", NoteFormat.HP))).thenReturn(note);
    when(orchestrator.beautify(note)).thenReturn("# HISTORY & PHYSICAL (H&P)");

    mockMvc
        .perform(
            post("/api/notes/regenerate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"transcriptText\":\"Knee pain.\",\"format\":\"H&P\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.format").value("H&P"))
        .andExpect(jsonPath("$.producingModel").value(NoteResult.TEMPLATE_FALLBACK))
        .andExpect(jsonPath("$.markdown").value("# HISTORY & PHYSICAL (H&P)"));

    verify(orchestrator, never()).process(any(ScribeRequest.class));
  }

  @Test
  void regenerate_shouldRejectBlankTranscript() throws Exception {
    mockMvc
        .perform(
            post("/api/notes/regenerate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"transcriptText\":\"\",\"format\":\"SOAP\"}"))
        .andExpect(status().isBadRequest());
  }

  private void stubCreate() {
    when(jobRepository.create(any(ScribeRequest.class)))
        .thenAnswer(invocation -> new NoteJob("job-new", invocation.getArgument(0)));
  }

  private static NoteJob completedJob() {
    NoteJob job = new NoteJob("job-1", ScribeRequest.forUrl("https://cdn.test/a", true, NoteFormat.SOAP));
    NoteResult note =
        new NoteResult("SOAP NOTE\nS – Subjective\n", NoteFormat.SOAP, "gemini-2.5-flash", List.of());
    job.setResult(
        new ScribeResult(
            "tx-1", "Hello.", List.of(), note, "# SOAP NOTE\n\n## S – Subjective", null));
    job.setStatus(Status.COMPLETED);
    return job;
  }
}
