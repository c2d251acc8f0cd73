package com.flamingo.ai.autocategorize.domain.model;

/** The rule an annotation record was created under; links the record to a category. */
public record AnnotationRule(String id, String ruleName, String categoryId) {}
