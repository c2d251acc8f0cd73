package com.flamingo.ai.autocategorize.service.extraction;

import com.flamingo.ai.autocategorize.domain.enums.FileType;

/** Converts a candidate file into content the categorization engine can match. */
public interface ContentExtractionService {

  /**
   * Extracts content of the given type.
   *
   * @param file candidate file
   * @param fileType modality to extract
   * @return content, never null; empty content when an external provider failed
   * @throws com.flamingo.ai.autocategorize.exception.ContentUnavailableException if the file is
   *     empty, corrupt or not decodable
   */
  ExtractedContent extract(SourceFile file, FileType fileType);
}
