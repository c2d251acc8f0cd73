package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.domain.model.AnnotationPattern;
import com.flamingo.ai.autocategorize.domain.model.MatchCandidate;
import java.util.Optional;

/** Scores one stored pattern against the candidate content captured by the implementation. */
@FunctionalInterface
public interface PatternScorer<P extends AnnotationPattern> {

  /**
   * @param pattern stored pattern
   * @param category resolved category name of the pattern's record
   * @return a candidate, or empty when the pattern does not match
   */
  Optional<MatchCandidate> score(P pattern, String category);
}
