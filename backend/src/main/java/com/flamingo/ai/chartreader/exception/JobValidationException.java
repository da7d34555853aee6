package com.flamingo.ai.chartreader.exception;

/**
 * Exception thrown when a job's input cannot be processed: missing file, no entry date,
 * unsupported file type, or an invalid request such as a page outside the document.
 *
 * <p>Validation failures are terminal for a job and are never retried automatically.
 */
public class JobValidationException extends RuntimeException {

  private final String userMessage;

  public JobValidationException(String message) {
    super(message);
    this.userMessage = message;
  }

  public JobValidationException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = message;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
