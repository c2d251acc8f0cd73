package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.PatternKind;

/** A key/value pair selected in a JSON document. */
public record JsonPattern(String id, String label, String jsonKey, String jsonValue)
    implements AnnotationPattern {

  @Override
  public PatternKind kind() {
    return PatternKind.JSON;
  }
}
