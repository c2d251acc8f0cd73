package com.flamingo.ai.autocategorize.exception;

/** Exception thrown when an OCR, vision or speech provider call fails. */
public class ExternalServiceException extends RuntimeException {

  private final String provider;
  private final boolean rateLimited;

  public ExternalServiceException(String provider, String message) {
    super(message);
    this.provider = provider;
    this.rateLimited = false;
  }

  public ExternalServiceException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.rateLimited = false;
  }

  public ExternalServiceException(String provider, String message, boolean rateLimited) {
    super(message);
    this.provider = provider;
    this.rateLimited = rateLimited;
  }

  public String getProvider() {
    return provider;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }
}
