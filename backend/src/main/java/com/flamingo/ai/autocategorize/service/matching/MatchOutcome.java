package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidates produced by one matcher plus modality-specific diagnostics.
 *
 * @param candidates evidence in corpus order
 * @param diagnostics values describing the candidate content, e.g. page count or speech rate
 */
public record MatchOutcome(List<MatchCandidate> candidates, Map<String, Object> diagnostics) {

  public MatchOutcome {
    candidates = candidates == null ? List.of() : List.copyOf(candidates);
    diagnostics =
        diagnostics == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
  }

  public static MatchOutcome empty(Map<String, Object> diagnostics) {
    return new MatchOutcome(List.of(), diagnostics);
  }
}
