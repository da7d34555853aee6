package com.flamingo.ai.chartreader.exception;

/**
 * Exception thrown when the extraction model call fails or returns unusable output.
 *
 * <p>Remote failures are retryable; malformed or empty output is not, since asking again with the
 * same image rarely helps.
 */
public class ChartExtractionException extends RuntimeException {

  private final boolean retryable;
  private final boolean rateLimited;
  private final String userMessage;

  /** Unusable model output. Not retried. */
  public ChartExtractionException(String message) {
    super(message);
    this.retryable = false;
    this.rateLimited = false;
    this.userMessage = message;
  }

  /** Unusable model output caused by a parse failure. Not retried. */
  public ChartExtractionException(String message, Throwable cause) {
    super(message, cause);
    this.retryable = false;
    this.rateLimited = false;
    this.userMessage = message;
  }

  /** Remote call failure. Retried. */
  public ChartExtractionException(String message, boolean rateLimited, Throwable cause) {
    super(message, cause);
    this.retryable = true;
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "Extraction service is temporarily busy. Please try again in a moment."
            : "Extraction service is temporarily unavailable. Please try again later.";
  }

  public boolean isRetryable() {
    return retryable;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
