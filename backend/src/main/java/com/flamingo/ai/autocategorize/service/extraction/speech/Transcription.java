package com.flamingo.ai.autocategorize.service.extraction.speech;

import com.flamingo.ai.autocategorize.domain.model.TranscriptWord;
import com.flamingo.ai.autocategorize.service.extraction.ProviderStatus;
import java.util.List;

/** Timed words of a recording and whether the provider answered. */
public record Transcription(List<TranscriptWord> words, ProviderStatus status) {

  public Transcription {
    words = words == null ? List.of() : List.copyOf(words);
  }

  public static Transcription disabled() {
    return new Transcription(List.of(), ProviderStatus.DISABLED);
  }

  public static Transcription failed() {
    return new Transcription(List.of(), ProviderStatus.FAILED);
  }
}
