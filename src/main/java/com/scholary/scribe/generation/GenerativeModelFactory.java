package com.scholary.scribe.generation;

/**
 * Binds model identifiers to {@link GenerativeModel}s.
 *
 * <p>An unconfigured factory (no credential) never binds a model; callers check {@link
 * #isConfigured()} first.
 */
public interface GenerativeModelFactory {

  boolean isConfigured();

  GenerativeModel bind(String modelId);
}
