package com.flamingo.ai.autocategorize.domain.enums;

/** Finer-grained classification of how a stored pattern matched the candidate content. */
public enum MatchType {
  // PDF keyword matches
  EXACT,
  PARTIAL,
  KEYWORD,

  // JSON tiers, strongest first
  EXACT_KEY,
  EXACT_VALUE,
  PARTIAL_KEY,
  PARTIAL_VALUE,

  // Audio
  TRANSCRIPT_TEXT,
  TRANSCRIPT_KEYWORD,

  // Image
  OCR_TEXT,
  VISUAL_OBJECT,
  VISUAL_LOGO,
  VISUAL_PATTERN,
  VISUAL_FALLBACK,
  SIMILAR_IMAGE
}
