package com.flamingo.ai.autocategorize.domain.enums;

/** Which matcher produced a piece of evidence. */
public enum EvidenceKind {
  IMAGE_TEXT,
  IMAGE_VISUAL,
  IMAGE_SIMILARITY,
  PDF_KEYWORD,
  JSON_KEY_VALUE,
  AUDIO_SEGMENT
}
