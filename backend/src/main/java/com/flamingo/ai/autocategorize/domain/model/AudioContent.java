package com.flamingo.ai.autocategorize.domain.model;

import com.flamingo.ai.autocategorize.domain.enums.FileType;
import java.util.List;
import java.util.stream.Collectors;

/** Transcript of an audio file as timed words. */
public record AudioContent(List<TranscriptWord> words) implements CandidateContent {

  public AudioContent {
    words = words == null ? List.of() : List.copyOf(words);
  }

  /** The words joined by single spaces. */
  public String transcript() {
    return words.stream().map(TranscriptWord::word).collect(Collectors.joining(" "));
  }

  @Override
  public FileType fileType() {
    return FileType.AUDIO;
  }

  @Override
  public boolean isEmpty() {
    return words.isEmpty();
  }
}
