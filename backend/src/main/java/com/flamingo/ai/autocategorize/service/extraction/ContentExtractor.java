package com.flamingo.ai.autocategorize.service.extraction;

import com.flamingo.ai.autocategorize.domain.enums.FileType;

/** Turns the bytes of one modality into {@code CandidateContent}. */
public interface ContentExtractor {

  boolean supports(FileType fileType);

  /**
   * Extracts content. Provider failures are absorbed and reported through {@link
   * ExtractedContent#degradedProviders()}.
   *
   * @throws com.flamingo.ai.autocategorize.exception.ContentUnavailableException if the file
   *     itself cannot be decoded
   */
  ExtractedContent extract(SourceFile file);
}
