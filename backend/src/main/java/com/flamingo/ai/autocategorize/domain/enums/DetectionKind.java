package com.flamingo.ai.autocategorize.domain.enums;

/** Kind of region reported by the external object/logo detector. */
public enum DetectionKind {
  OBJECT,
  LOGO
}
