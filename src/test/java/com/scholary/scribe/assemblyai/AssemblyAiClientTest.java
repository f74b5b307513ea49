package com.scholary.scribe.assemblyai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AssemblyAiClientTest {

  private static final String BASE_URL = "https://api.test/v2";

  @Mock private HttpClient httpClient;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private AssemblyAiClient client;

  @BeforeEach
  void setUp() {
    client = clientWith(properties("secret-key", Duration.ofMillis(1), Duration.ofSeconds(5)));
  }

  @Test
  void upload_shouldPostBytesAndReturnUploadUrl() throws Exception {
    doReturn(StubHttpResponse.ok("{\"upload_url\":\"https://cdn.test/audio/1\"}"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    String url = client.upload(new byte[] {1, 2, 3});

    assertThat(url).isEqualTo("https://cdn.test/audio/1");
    HttpRequest request = captureSingleRequest();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.uri().toString()).isEqualTo(BASE_URL + "/upload");
    assertThat(request.headers().firstValue("authorization")).contains("secret-key");
  }

  @Test
  void upload_shouldFailOnNon2xxWithoutRetry() throws Exception {
    doReturn(StubHttpResponse.status(401, "{\"error\":\"Invalid API key\"}"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> client.upload(new byte[] {1}))
        .isInstanceOf(TransportException.class)
        .satisfies(e -> assertThat(((TransportException) e).getStatusCode()).isEqualTo(401));

    verify(httpClient, times(1)).send(any(HttpRequest.class), any());
  }

  @Test
  void upload_shouldWrapNetworkFailure() throws Exception {
    doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> client.upload(new byte[] {1}))
        .isInstanceOf(TransportException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void submit_shouldReturnJobId() throws Exception {
    doReturn(StubHttpResponse.job("tx-42", "queued")).when(httpClient).send(any(HttpRequest.class), any());

    String id = client.submit("https://cdn.test/audio/1", true);

    assertThat(id).isEqualTo("tx-42");
    HttpRequest request = captureSingleRequest();
    assertThat(request.uri().toString()).isEqualTo(BASE_URL + "/transcript");
    assertThat(request.headers().firstValue("Content-Type")).contains("application/json");
  }

  @Test
  void submit_shouldFailWhenResponseHasNoId() throws Exception {
    doReturn(StubHttpResponse.ok("{}")).when(httpClient).send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> client.submit("https://cdn.test/audio/1", true))
        .isInstanceOf(TransportException.class)
        .hasMessageContaining("'id'");
  }

  @Test
  void submitPayload_shouldCarryFixedOptionsAndSpeakerFlag() {
    ObjectNode payload = client.submitPayload("https://cdn.test/a.mp3", false);

    assertThat(payload.get("audio_url").asText()).isEqualTo("https://cdn.test/a.mp3");
    assertThat(payload.get("speaker_labels").asBoolean()).isFalse();
    assertThat(payload.get("format_text").asBoolean()).isTrue();
    assertThat(payload.get("punctuate").asBoolean()).isTrue();
    assertThat(payload.get("language_detection").asBoolean()).isTrue();
    assertThat(payload.get("speech_model").asText()).isEqualTo("universal");
  }

  @Test
  void poll_shouldCheckUntilCompleted() throws Exception {
    doReturn(
            StubHttpResponse.job("tx-1", "queued"),
            StubHttpResponse.job("tx-1", "processing"),
            StubHttpResponse.job("tx-1", "processing"),
            StubHttpResponse.ok(
                "{\"id\":\"tx-1\",\"status\":\"completed\",\"text\":\"Patient denies fever.\"}"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    TranscriptionJob job = client.poll("tx-1");

    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.text()).isEqualTo("Patient denies fever.");
    assertThat(job.payload().get("status").asText()).isEqualTo("completed");

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient, times(4)).send(captor.capture(), any());
    assertThat(captor.getAllValues())
        .allSatisfy(
            r -> {
              assertThat(r.method()).isEqualTo("GET");
              assertThat(r.uri().toString()).isEqualTo(BASE_URL + "/transcript/tx-1");
            });
  }

  @Test
  void poll_shouldStopImmediatelyOnError() throws Exception {
    doReturn(
            StubHttpResponse.job("tx-1", "queued"),
            StubHttpResponse.ok("{\"id\":\"tx-1\",\"status\":\"error\",\"error\":\"Audio file is empty\"}"),
            StubHttpResponse.job("tx-1", "completed"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> client.poll("tx-1"))
        .isInstanceOf(JobFailedException.class)
        .satisfies(
            e -> assertThat(((JobFailedException) e).getDetail()).isEqualTo("Audio file is empty"));

    verify(httpClient, times(2)).send(any(HttpRequest.class), any());
  }

  @Test
  void poll_shouldKeepWaitingOnUnrecognizedStatus() throws Exception {
    doReturn(
            StubHttpResponse.job("tx-1", "rerouting"),
            StubHttpResponse.ok("{\"id\":\"tx-1\"}"),
            StubHttpResponse.job("tx-1", "completed"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    TranscriptionJob job = client.poll("tx-1");

    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    verify(httpClient, times(3)).send(any(HttpRequest.class), any());
  }

  @Test
  void poll_shouldTimeOutAfterMaxDuration() throws Exception {
    client = clientWith(properties("secret-key", Duration.ofMillis(5), Duration.ofMillis(30)));
    doReturn(StubHttpResponse.job("tx-1", "processing"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> client.poll("tx-1"))
        .isInstanceOf(PollTimeoutException.class)
        .satisfies(e -> assertThat(((PollTimeoutException) e).getStatusChecks()).isPositive());
  }

  @Test
  void poll_shouldNotCallServiceWhenAlreadyCancelled() throws Exception {
    CancellationToken token = CancellationToken.create();
    token.cancel();

    assertThatThrownBy(() -> client.poll("tx-1", token)).isInstanceOf(PollCancelledException.class);

    verify(httpClient, never()).send(any(HttpRequest.class), any());
  }

  @Test
  void poll_shouldWakeUpFromWaitWhenCancelled() throws Exception {
    client = clientWith(properties("secret-key", Duration.ofMinutes(10), Duration.ofHours(1)));
    CancellationToken token = CancellationToken.create();
    doAnswer(
            invocation -> {
              token.cancel();
              return StubHttpResponse.job("tx-1", "processing");
            })
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> client.poll("tx-1", token))
        .isInstanceOf(PollCancelledException.class)
        .isNotInstanceOf(JobFailedException.class);

    verify(httpClient, times(1)).send(any(HttpRequest.class), any());
  }

  @Test
  void poll_shouldSurfaceTransportFailure() throws Exception {
    doReturn(StubHttpResponse.job("tx-1", "queued"), StubHttpResponse.status(503, "unavailable"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> client.poll("tx-1"))
        .isInstanceOf(TransportException.class)
        .hasMessageContaining("503");
  }

  @Test
  void calls_shouldFailWithoutApiKey() throws Exception {
    client = clientWith(properties("", Duration.ofMillis(1), Duration.ofSeconds(1)));

    assertThatThrownBy(() -> client.submit("https://cdn.test/a.mp3", true))
        .isInstanceOf(TransportException.class)
        .hasMessageContaining("API key");

    verify(httpClient, never()).send(any(HttpRequest.class), any());
  }

  @Test
  void fetch_shouldExposeUtterancesAsReceived() throws Exception {
    doReturn(
            StubHttpResponse.ok(
                "{\"id\":\"tx-1\",\"status\":\"completed\",\"text\":\"Hi.\","
                    + "\"utterances\":[{\"speaker\":\"A\",\"text\":\"Hi.\",\"start\":0,\"end\":500}]}"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    TranscriptionJob job = client.fetch("tx-1");

    assertThat(job.utterances().isArray()).isTrue();
    assertThat(job.utterances().size()).isEqualTo(1);
  }

  private HttpRequest captureSingleRequest() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    List<HttpRequest> requests = captor.getAllValues();
    assertThat(requests).hasSize(1);
    return requests.get(0);
  }

  private AssemblyAiClient clientWith(AssemblyAiProperties properties) {
    return new AssemblyAiClient(properties, objectMapper, httpClient);
  }

  private static AssemblyAiProperties properties(
      String apiKey, Duration pollInterval, Duration maxPollDuration) {
    return new AssemblyAiProperties(
        BASE_URL, apiKey, "universal", 5, 5, pollInterval, maxPollDuration);
  }
}
