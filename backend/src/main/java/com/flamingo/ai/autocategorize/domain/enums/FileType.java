package com.flamingo.ai.autocategorize.domain.enums;

import java.util.Locale;

/** Modality of a candidate file. Exactly one matcher runs per file type. */
public enum FileType {
  IMAGE,
  PDF,
  JSON,
  AUDIO;

  /**
   * Parses a request parameter such as {@code "pdf"} or {@code "IMAGE"}.
   *
   * @param value raw value, may be null or blank
   * @return the file type, or null when the value is blank
   * @throws IllegalArgumentException if the value names no known type
   */
  public static FileType fromParameter(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return FileType.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
