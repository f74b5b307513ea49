package com.scholary.scribe.assemblyai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.scribe.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the AssemblyAI v2 transcript API.
 *
 * <p>Handles the three calls of a transcription job: {@code POST /upload} with the raw audio,
 * {@code POST /transcript} to start the job and {@code GET /transcript/{id}} to check on it.
 * Upload and submit are single attempts; a failure surfaces as {@link TransportException}.
 *
 * <p>The poll loop checks status every {@code pollInterval} until the job completes, fails, runs
 * past {@code maxPollDuration} or is cancelled. Statuses other than completed and error, including
 * ones this client does not know, mean "keep waiting".
 */
public class AssemblyAiClient implements TranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssemblyAiClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final HttpClient httpClient;
  private final AssemblyAiProperties properties;
  private final ObjectMapper objectMapper;

  public AssemblyAiClient(AssemblyAiProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  public AssemblyAiClient(
      AssemblyAiProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;

    LOGGER.info(
        "Initialized AssemblyAI client: baseUrl={}, pollInterval={}, maxPollDuration={}",
        properties.baseUrl(),
        properties.pollInterval(),
        properties.maxPollDuration());
  }

  @Override
  public String upload(byte[] audio) {
    LOGGER.info("Uploading audio: {} bytes", audio.length);

    HttpRequest request =
        authorized("/upload")
            .header("Content-Type", "application/octet-stream")
            .POST(BodyPublishers.ofByteArray(audio))
            .build();

    JsonNode body = execute(request, "upload");
    String uploadUrl = requiredField(body, "upload_url", "upload");
    LOGGER.debug("Audio uploaded to {}", uploadUrl);
    return uploadUrl;
  }

  @Override
  public String submit(String audioUrl, boolean speakerLabels) {
    String json;
    try {
      json = objectMapper.writeValueAsString(submitPayload(audioUrl, speakerLabels));
    } catch (IOException e) {
      throw new TransportException("Failed to encode transcript request", e);
    }

    HttpRequest request =
        authorized("/transcript")
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(json, StandardCharsets.UTF_8))
            .build();

    JsonNode body = execute(request, "submit");
    String transcriptId = requiredField(body, "id", "submit");
    structuredLogger.logTranscriptSubmitted(transcriptId, speakerLabels);
    return transcriptId;
  }

  @Override
  public TranscriptionJob poll(String transcriptId, CancellationToken cancellation) {
    long deadline = System.nanoTime() + properties.maxPollDuration().toNanos();
    int statusChecks = 0;

    while (true) {
      if (cancellation.isCancelled()) {
        throw new PollCancelledException(transcriptId);
      }

      TranscriptionJob job = fetch(transcriptId);
      statusChecks++;
      structuredLogger.logTranscriptPolled(transcriptId, job.status().wireValue(), statusChecks);

      if (job.status().isTerminal()) {
        if (job.status() == JobStatus.ERROR) {
          throw new JobFailedException(transcriptId, job.error());
        }
        LOGGER.info("Transcription {} completed after {} status checks", transcriptId, statusChecks);
        return job;
      }

      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new PollTimeoutException(transcriptId, properties.maxPollDuration(), statusChecks);
      }

      Duration wait = Duration.ofNanos(Math.min(properties.pollInterval().toNanos(), remaining));
      try {
        if (cancellation.awaitCancellation(wait)) {
          throw new PollCancelledException(transcriptId);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PollCancelledException(transcriptId);
      }
    }
  }

  /** Single status check, no waiting. */
  public TranscriptionJob fetch(String transcriptId) {
    HttpRequest request = authorized("/transcript/" + transcriptId).GET().build();
    return TranscriptionJob.fromPayload(execute(request, "status"));
  }

  ObjectNode submitPayload(String audioUrl, boolean speakerLabels) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("audio_url", audioUrl);
    payload.put("speaker_labels", speakerLabels);
    payload.put("format_text", true);
    payload.put("punctuate", true);
    payload.put("speech_model", properties.speechModel());
    payload.put("language_detection", true);
    return payload;
  }

  private HttpRequest.Builder authorized(String path) {
    if (!properties.hasApiKey()) {
      throw new TransportException("AssemblyAI API key is not configured", -1);
    }
    return HttpRequest.newBuilder()
        .uri(URI.create(properties.baseUrl() + path))
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("authorization", properties.apiKey());
  }

  private JsonNode execute(HttpRequest request, String operation) {
    LOGGER.debug("Sending {} request to {}", operation, request.uri());

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new TransportException(String.format("AssemblyAI %s request failed", operation), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException(String.format("AssemblyAI %s request interrupted", operation), e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new TransportException(
          String.format("AssemblyAI %s returned status %d: %s", operation, status, response.body()),
          status);
    }

    try {
      JsonNode body = objectMapper.readTree(response.body());
      if (body == null || !body.isObject()) {
        throw new TransportException(
            String.format("AssemblyAI %s returned a non-object body", operation), status);
      }
      return body;
    } catch (IOException e) {
      throw new TransportException(String.format("AssemblyAI %s returned invalid JSON", operation), e);
    }
  }

  private static String requiredField(JsonNode body, String field, String operation) {
    JsonNode value = body.get(field);
    if (value == null || value.isNull() || value.asText().isEmpty()) {
      throw new TransportException(
          String.format("AssemblyAI %s response is missing '%s'", operation, field), 200);
    }
    return value.asText();
  }
}
