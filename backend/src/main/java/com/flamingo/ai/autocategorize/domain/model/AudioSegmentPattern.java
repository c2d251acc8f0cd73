package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.PatternKind;

/**
 * A span of a transcribed recording.
 *
 * @param text transcript text of the span
 * @param keywordText optional keyword attached to the span
 * @param startTime start offset in seconds within the annotated recording
 * @param endTime end offset in seconds within the annotated recording
 */
public record AudioSegmentPattern(
    String id, String label, String text, String keywordText, Double startTime, Double endTime)
    implements AnnotationPattern {

  @Override
  public PatternKind kind() {
    return PatternKind.AUDIO_SEGMENT;
  }
}
