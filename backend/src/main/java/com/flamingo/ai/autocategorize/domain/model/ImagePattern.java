package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.PatternKind;

/** A text region drawn on an image, with the OCR text read inside it. */
public record ImagePattern(
    String id, String label, String ocrText, BoundingBox boundingBox, Double ocrConfidence)
    implements AnnotationPattern {

  @Override
  public PatternKind kind() {
    return PatternKind.IMAGE;
  }
}
