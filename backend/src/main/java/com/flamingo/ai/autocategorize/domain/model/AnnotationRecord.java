package com.flamingo.ai.autocategorize.domain.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * Immutable corpus entry: every pattern annotated on one file under one rule.
 *
 * @param dataId identifier of the annotated file
 * @param rule rule linking the record to its category; may be null for legacy records
 * @param annotations the patterns, already parsed into their kinds
 * @param type file type label of the annotated file
 */
public record AnnotationRecord(
    String dataId, AnnotationRule rule, List<AnnotationPattern> annotations, String type) {

  public AnnotationRecord {
    annotations = annotations == null ? List.of() : List.copyOf(annotations);
  }

  /** Category id of the rule, or null when the record has no rule. */
  public String categoryId() {
    return rule == null ? null : rule.categoryId();
  }

  /** Patterns of one kind, in stored order. */
  public <P extends AnnotationPattern> Stream<P> patternsOf(Class<P> kind) {
    return annotations.stream().filter(kind::isInstance).map(kind::cast);
  }
}
