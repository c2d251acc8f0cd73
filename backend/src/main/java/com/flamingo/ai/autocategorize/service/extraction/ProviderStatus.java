package com.flamingo.ai.autocategorize.service.extraction;

/** Whether an external provider contributed to extracted content. */
public enum ProviderStatus {
  /** The provider answered. */
  OK,
  /** No provider is configured. */
  DISABLED,
  /** The provider was called and failed; its output is missing. */
  FAILED
}
