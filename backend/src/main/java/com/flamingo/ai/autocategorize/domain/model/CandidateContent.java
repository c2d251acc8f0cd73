package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.FileType;

/**
 * Content extracted from a candidate file for the duration of one analysis call. One variant per
 * modality; matchers check the variant instead of probing optional fields.
 */
public sealed interface CandidateContent
    permits ImageContent, PdfContent, JsonContent, AudioContent {

  FileType fileType();

  /** True when extraction produced nothing a matcher could compare against. */
  boolean isEmpty();
}
