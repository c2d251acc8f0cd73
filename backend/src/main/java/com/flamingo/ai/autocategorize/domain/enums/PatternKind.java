package com.flamingo.ai.autocategorize.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/** Tag values stored in the {@code annotationType} field of corpus annotations. */
public enum PatternKind {
  IMAGE("image"),
  VISUAL("visual"),
  PDF("pdf"),
  JSON("json"),
  AUDIO_SEGMENT("audio_segment");

  private final String tag;

  PatternKind(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  public static Optional<PatternKind> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(k -> k.tag.equalsIgnoreCase(tag.trim())).findFirst();
  }
}
