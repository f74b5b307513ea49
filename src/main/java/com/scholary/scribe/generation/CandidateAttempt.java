package com.scholary.scribe.generation;

/**
 * Record of one candidate tried by {@link ModelFallbackSelector}.
 *
 * <p>{@code reason} is null for the successful attempt.
 */
public record CandidateAttempt(String modelId, Stage stage, boolean succeeded, String reason) {

  public enum Stage {
    PROBE,
    GENERATE
  }

  static CandidateAttempt success(String modelId) {
    return new CandidateAttempt(modelId, Stage.GENERATE, true, null);
  }

  static CandidateAttempt failure(String modelId, Stage stage, Exception cause) {
    String reason = cause.getClass().getSimpleName();
    if (cause.getMessage() != null) {
      reason = reason + ": " + cause.getMessage();
    }
    return new CandidateAttempt(modelId, stage, false, reason);
  }
}
