package com.flamingo.ai.autocategorize.exception;

/** Thrown when a file type is neither detected nor declared as one of the supported kinds. */
public class UnsupportedFileTypeException extends RuntimeException {

  private final String detectedType;

  public UnsupportedFileTypeException(String detectedType) {
    super("Unsupported file type: " + detectedType);
    this.detectedType = detectedType;
  }

  public String getDetectedType() {
    return detectedType;
  }
}
