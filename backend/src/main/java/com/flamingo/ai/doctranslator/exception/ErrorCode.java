package com.flamingo.ai.doctranslator.exception;

/** Failure categories raised by the translation pipeline. */
public enum ErrorCode {
  /** Missing or rejected credentials for a model client. Fatal for the whole job. */
  CONFIG_ERROR(false),

  /** Extracted or translated text failed structural validation. */
  CONTENT_ERROR(true),

  /** The vision model call failed during page extraction. */
  PROCESSING_ERROR(false),

  /** Transient upstream failure: network, rate limit or timeout. */
  PROVIDER_ERROR(true),

  /** Chunk translation failed after all attempts. */
  TRANSLATION_ERROR(false),

  /** A job with the same process id already exists. */
  ALREADY_EXISTS(false);

  private final boolean retryable;

  ErrorCode(boolean retryable) {
    this.retryable = retryable;
  }

  /** Whether chunk translation retries this failure internally. */
  public boolean isRetryable() {
    return retryable;
  }
}
