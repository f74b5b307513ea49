package com.scholary.scribe.note;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * Loads note prompt templates from {@code templates/<name>.txt} on the classpath.
 *
 * <p>Templates have one placeholder, {@value #PLACEHOLDER}, replaced by the transcript text.
 */
@Component
public class PromptTemplates {

  public static final String PLACEHOLDER = "{{TRANSCRIPT_HERE}}";

  private final Map<NoteFormat, String> cache = new ConcurrentHashMap<>();

  public String render(NoteFormat format, String transcriptText) {
    return template(format).replace(PLACEHOLDER, transcriptText);
  }

  public String template(NoteFormat format) {
    return cache.computeIfAbsent(format, PromptTemplates::load);
  }

  private static String load(NoteFormat format) {
    ClassPathResource resource = new ClassPathResource("templates/" + format.templateName() + ".txt");
    try (InputStream in = resource.getInputStream()) {
      return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load prompt template: " + resource.getPath(), e);
    }
  }
}
