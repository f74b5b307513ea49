package com.scholary.scribe.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.scribe.assemblyai.AssemblyAiClient;
import com.scholary.scribe.assemblyai.AssemblyAiProperties;
import com.scholary.scribe.assemblyai.TranscriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the transcription client.
 *
 * <p>Wires up the TranscriptionService bean using properties from application.yml.
 */
@Configuration
@EnableConfigurationProperties(AssemblyAiProperties.class)
public class AssemblyAiConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssemblyAiConfig.class);

  @Bean
  public TranscriptionService transcriptionService(
      AssemblyAiProperties properties, ObjectMapper objectMapper) {
    if (!properties.hasApiKey()) {
      LOGGER.error("AssemblyAI API key not set; transcription requests will fail. Set ASSEMBLYAI_API_KEY.");
    }
    return new AssemblyAiClient(properties, objectMapper);
  }
}
