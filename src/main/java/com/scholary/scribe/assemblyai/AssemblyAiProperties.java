package com.scholary.scribe.assemblyai;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the AssemblyAI transcription client.
 *
 * <p>Timeouts are in seconds. The poll interval and maximum poll duration bound the status loop;
 * the key may be blank at startup, in which case every call fails with a transport error.
 */
@ConfigurationProperties(prefix = "assemblyai")
@Validated
public record AssemblyAiProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String speechModel,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotNull Duration pollInterval,
    @NotNull Duration maxPollDuration) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
