package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.PatternKind;

/**
 * A labelled fragment of a previously annotated file. Owned by its {@link AnnotationRecord} and
 * never mutated by the matchers.
 */
public sealed interface AnnotationPattern
    permits ImagePattern, VisualPattern, PdfPattern, JsonPattern, AudioSegmentPattern {

  String id();

  String label();

  PatternKind kind();
}
