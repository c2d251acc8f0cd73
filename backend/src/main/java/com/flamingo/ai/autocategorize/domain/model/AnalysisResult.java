package com.flamingo.ai.autocategorize.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one analysis: the winning category, its confidence, the evidence and diagnostics. This
 * is the only thing handed to the persistence collaborator.
 */
public record AnalysisResult(
    String category,
    double confidence,
    List<MatchCandidate> matches,
    Map<String, Object> diagnostics) {

  public static final String UNCATEGORIZED = "uncategorized";

  public AnalysisResult {
    matches = matches == null ? List.of() : List.copyOf(matches);
    diagnostics =
        diagnostics == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    if (Double.isNaN(confidence)) {
      confidence = 0.0;
    }
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  public static AnalysisResult uncategorized(Map<String, Object> diagnostics) {
    return new AnalysisResult(UNCATEGORIZED, 0.0, List.of(), diagnostics);
  }

  public boolean isCategorized() {
    return !UNCATEGORIZED.equals(category);
  }

  /** Copy of this result with extra diagnostic entries; existing keys are overwritten. */
  public AnalysisResult withDiagnostics(Map<String, Object> extra) {
    Map<String, Object> merged = new LinkedHashMap<>(diagnostics);
    merged.putAll(extra);
    return new AnalysisResult(category, confidence, matches, merged);
  }
}
