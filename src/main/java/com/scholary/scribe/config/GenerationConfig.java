package com.scholary.scribe.config;

import com.scholary.scribe.generation.GeminiModelFactory;
import com.scholary.scribe.generation.GenerationProperties;
import com.scholary.scribe.generation.GenerativeModelFactory;
import com.scholary.scribe.generation.ModelCandidate;
import com.scholary.scribe.generation.ModelFallbackSelector;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for note generation.
 *
 * <p>Builds the Gemini model factory and the fallback selector over the configured priority list.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(GenerationConfig.class);

  @Bean
  public GenerativeModelFactory generativeModelFactory(GenerationProperties properties) {
    if (!properties.hasApiKey()) {
      LOGGER.warn("GEMINI_API_KEY not set; notes will use the template fallback.");
    }
    return new GeminiModelFactory(properties.apiKey());
  }

  @Bean
  public ModelFallbackSelector modelFallbackSelector(
      GenerativeModelFactory modelFactory, GenerationProperties properties) {
    List<ModelCandidate> candidates = ModelCandidate.expand(properties.models());
    LOGGER.info("Generation candidates: {}", candidates.size());
    return new ModelFallbackSelector(modelFactory, candidates);
  }
}
