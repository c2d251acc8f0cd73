package com.flamingo.ai.autocategorize.service.matching;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import com.flamingo.ai.autocategorize.domain.model.AnalysisRequest;

/**
 * Strategy for turning the extracted content of one modality into match candidates against the
 * annotation corpus.
 */
public interface ModalityMatcher {

  /** Returns true if this matcher handles the given file type. */
  boolean supports(FileType fileType);

  /**
   * Scores every relevant stored pattern against the request content.
   *
   * @param request the analysis request; its content is of this matcher's modality
   * @return candidates in corpus order with diagnostics
   */
  MatchOutcome match(AnalysisRequest request);
}
