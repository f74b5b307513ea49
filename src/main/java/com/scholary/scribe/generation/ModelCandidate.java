package com.scholary.scribe.generation;

import java.util.ArrayList;
import java.util.List;

/** One model identifier in the generation priority list. */
public record ModelCandidate(String modelId) {

  public static final String NAMESPACE = "models/";

  /**
   * Expand base names into candidates, each bare spelling followed by its namespaced spelling.
   *
   * <p>{@code [a, b]} becomes {@code [a, models/a, b, models/b]}. Names already carrying the
   * namespace are kept as they are.
   */
  public static List<ModelCandidate> expand(List<String> baseNames) {
    List<ModelCandidate> candidates = new ArrayList<>();
    for (String name : baseNames) {
      if (name == null || name.isBlank()) {
        continue;
      }
      String trimmed = name.trim();
      candidates.add(new ModelCandidate(trimmed));
      if (!trimmed.startsWith(NAMESPACE)) {
        candidates.add(new ModelCandidate(NAMESPACE + trimmed));
      }
    }
    return List.copyOf(candidates);
  }
}
