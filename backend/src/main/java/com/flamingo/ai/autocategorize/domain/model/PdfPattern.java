package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.PatternKind;

/** A keyword selected in a PDF. {@code pageNumber} is where it was annotated, if known. */
public record PdfPattern(String id, String label, String keywordText, Integer pageNumber)
    implements AnnotationPattern {

  @Override
  public PatternKind kind() {
    return PatternKind.PDF;
  }
}
