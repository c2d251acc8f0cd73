package com.flamingo.ai.autocategorize.exception;

/**
 * Thrown when the candidate file cannot be read or decoded: a missing path, a corrupt PDF, invalid
 * JSON or an image no decoder understands.
 */
public class ContentUnavailableException extends RuntimeException {

  private final String source;
  private final String userMessage;

  public ContentUnavailableException(String source, String message) {
    super(message);
    this.source = source;
    this.userMessage = "The file content could not be read";
  }

  public ContentUnavailableException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
    this.userMessage = "The file content could not be read";
  }

  public String getSource() {
    return source;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
