package com.flamingo.ai.doctranslator.exception;

/** Exception thrown when a step of the translation pipeline fails. */
public class DocumentTranslationException extends RuntimeException {

  private final ErrorCode errorCode;
  private final Integer pageNumber;
  private final String userMessage;

  public DocumentTranslationException(ErrorCode errorCode, String message) {
    this(errorCode, message, null, null);
  }

  public DocumentTranslationException(ErrorCode errorCode, String message, Throwable cause) {
    this(errorCode, message, null, cause);
  }

  public DocumentTranslationException(
      ErrorCode errorCode, String message, Integer pageNumber, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.pageNumber = pageNumber;
    this.userMessage = userMessageFor(errorCode);
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /** Page the failure belongs to, or {@code null} when not tied to a page. */
  public Integer getPageNumber() {
    return pageNumber;
  }

  public String getUserMessage() {
    return userMessage;
  }

  public boolean isRetryable() {
    return errorCode.isRetryable();
  }

  private static String userMessageFor(ErrorCode errorCode) {
    return switch (errorCode) {
      case CONFIG_ERROR -> "Translation service is not configured. Please contact support.";
      case PROVIDER_ERROR -> "AI service is temporarily unavailable. Please try again later.";
      case ALREADY_EXISTS -> "A translation with this id is already in progress.";
      default -> "Failed to translate document";
    };
  }
}
