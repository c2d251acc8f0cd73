package com.flamingo.ai.autocategorize.service.aggregation;

import com.flamingo.ai.autocategorize.config.CategorizationConfig;
import com.flamingo.ai.autocategorize.config.CategorizationConfig.ConfidenceScope;
import com.flamingo.ai.autocategorize.domain.model.AnalysisResult;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns match candidates into a single category by majority vote.
 *
 * <p>The category with the most candidates wins and ties go to the category seen first. The
 * reported confidence is the highest candidate confidence, taken over all candidates or only over
 * the winner's, depending on {@code categorization.aggregation.confidence-scope}.
 */
@Component
@RequiredArgsConstructor
public class EvidenceAggregator {

  private final CategorizationConfig config;

  public Verdict aggregate(List<MatchCandidate> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      return new Verdict(AnalysisResult.UNCATEGORIZED, 0.0, Map.of());
    }

    Map<String, Integer> votes = new LinkedHashMap<>();
    for (MatchCandidate candidate : candidates) {
      votes.merge(candidate.category(), 1, Integer::sum);
    }

    String winner = null;
    int best = 0;
    for (Map.Entry<String, Integer> entry : votes.entrySet()) {
      if (entry.getValue() > best) {
        winner = entry.getKey();
        best = entry.getValue();
      }
    }

    boolean winnerOnly = config.getAggregation().getConfidenceScope() == ConfidenceScope.WINNER;
    double confidence = 0.0;
    for (MatchCandidate candidate : candidates) {
      if (!winnerOnly || Objects.equals(winner, candidate.category())) {
        confidence = Math.max(confidence, candidate.confidence());
      }
    }
    return new Verdict(winner, confidence, Collections.unmodifiableMap(votes));
  }
}
