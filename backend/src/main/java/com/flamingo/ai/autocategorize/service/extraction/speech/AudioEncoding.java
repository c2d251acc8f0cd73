package com.flamingo.ai.autocategorize.service.extraction.speech;

import java.util.Locale;

/** Audio encodings understood by the speech provider, chosen from the file extension. */
public enum AudioEncoding {
  LINEAR16,
  MP3,
  FLAC,
  AAC,
  OGG_OPUS;

  /** Maps a file extension to an encoding; unknown extensions are treated as WAV. */
  public static AudioEncoding fromExtension(String extension) {
    if (extension == null) {
      return LINEAR16;
    }
    return switch (extension.toLowerCase(Locale.ROOT)) {
      case "mp3" -> MP3;
      case "flac" -> FLAC;
      case "m4a", "aac" -> AAC;
      case "ogg" -> OGG_OPUS;
      default -> LINEAR16;
    };
  }
}
