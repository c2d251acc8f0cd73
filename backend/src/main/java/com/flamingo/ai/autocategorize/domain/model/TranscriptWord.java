package com.flamingo.ai.autocategorize.domain.model;

/** A transcribed word with its offsets in seconds. */
public record TranscriptWord(String word, double startTime, double endTime) {

  public double duration() {
    return endTime - startTime;
  }
}
