package com.scholary.scribe.note;

import com.scholary.scribe.generation.ModelFallbackSelector;
import com.scholary.scribe.generation.SelectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders the prompt for a note format and hands it to the {@link ModelFallbackSelector}.
 *
 * <p>The prompts require the model to use only information in the transcript and to write "Not
 * mentioned." for empty sections. Adherence is not checked here.
 */
@Component
public class NoteGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(NoteGenerator.class);

  private final PromptTemplates promptTemplates;
  private final ModelFallbackSelector selector;

  public NoteGenerator(PromptTemplates promptTemplates, ModelFallbackSelector selector) {
    this.promptTemplates = promptTemplates;
    this.selector = selector;
  }

  public boolean isConfigured() {
    return selector.isConfigured();
  }

  public SelectionResult generate(String transcriptText, NoteFormat format) {
    String prompt = promptTemplates.render(format, transcriptText);
    LOGGER.debug("Rendered {} prompt: {} chars", format, prompt.length());
    return selector.select(prompt);
  }
}
