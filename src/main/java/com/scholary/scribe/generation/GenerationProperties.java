package com.scholary.scribe.generation;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for note generation.
 *
 * <p>{@code models} is the priority list of base model names, tried first to last. A blank
 * {@code apiKey} disables generation and every note comes from the template fallback.
 */
@ConfigurationProperties(prefix = "generation")
@Validated
public record GenerationProperties(String apiKey, @NotNull List<String> models) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
