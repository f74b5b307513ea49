package com.scholary.scribe.generation;

import com.scholary.scribe.generation.CandidateAttempt.Stage;
import com.scholary.scribe.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries generation model candidates in priority order until one succeeds.
 *
 * <p>For each candidate: bind a model, probe it with an empty token count, then generate. Any
 * failure in either step moves on to the next candidate. Candidates are tried strictly one at a
 * time and nothing after the first success is called.
 *
 * <p>When every candidate fails, or no credential is configured, the result is empty rather than
 * an error. Callers treat empty as "use the template fallback".
 */
public class ModelFallbackSelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelFallbackSelector.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final GenerativeModelFactory modelFactory;
  private final List<ModelCandidate> candidates;

  public ModelFallbackSelector(GenerativeModelFactory modelFactory, List<ModelCandidate> candidates) {
    this.modelFactory = modelFactory;
    this.candidates = List.copyOf(candidates);
  }

  public boolean isConfigured() {
    return modelFactory.isConfigured();
  }

  /** Select against the configured priority list. */
  public SelectionResult select(String prompt) {
    return tryInOrder(candidates, prompt);
  }

  public SelectionResult tryInOrder(List<ModelCandidate> ordered, String prompt) {
    List<CandidateAttempt> attempts = new ArrayList<>();

    if (!modelFactory.isConfigured()) {
      LOGGER.info("Generation credential not configured, skipping {} candidates", ordered.size());
      return SelectionResult.exhausted(attempts);
    }

    for (ModelCandidate candidate : ordered) {
      String modelId = candidate.modelId();
      Stage stage = Stage.PROBE;
      try {
        GenerativeModel model = modelFactory.bind(modelId);
        model.countTokens("");

        stage = Stage.GENERATE;
        String text = model.generateContent(prompt);

        attempts.add(CandidateAttempt.success(modelId));
        LOGGER.info("Generated with model {} after {} attempts", modelId, attempts.size());
        return new SelectionResult(new GeneratedText(text == null ? "" : text, modelId), attempts);
      } catch (RuntimeException e) {
        CandidateAttempt attempt = CandidateAttempt.failure(modelId, stage, e);
        attempts.add(attempt);
        structuredLogger.logCandidateFailed(
            modelId, stage.name(), e.getClass().getSimpleName(), e.getMessage());
      }
    }

    LOGGER.warn("All {} generation candidates failed", attempts.size());
    return SelectionResult.exhausted(attempts);
  }
}
