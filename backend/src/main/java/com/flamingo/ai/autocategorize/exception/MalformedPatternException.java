package com.flamingo.ai.autocategorize.exception;

/** A stored annotation pattern is missing fields its type requires or carries unusable values. */
public class MalformedPatternException extends RuntimeException {

  private final String patternId;

  public MalformedPatternException(String patternId, String message) {
    super(message);
    this.patternId = patternId;
  }

  public String getPatternId() {
    return patternId;
  }
}
