package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.PatternKind;

/** A non-text region (logo, stamp, picture) drawn on an image. */
public record VisualPattern(String id, String label, BoundingBox boundingBox)
    implements AnnotationPattern {

  @Override
  public PatternKind kind() {
    return PatternKind.VISUAL;
  }
}
