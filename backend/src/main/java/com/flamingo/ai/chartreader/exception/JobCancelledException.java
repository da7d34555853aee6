package com.flamingo.ai.chartreader.exception;

/** Thrown at a pipeline checkpoint once the job's cancellation token has fired. */
public class JobCancelledException extends RuntimeException {

  public static final String DEFAULT_REASON = "Cancelled by user";

  private final String reason;

  public JobCancelledException(String reason) {
    super(reason == null || reason.isBlank() ? DEFAULT_REASON : reason);
    this.reason = getMessage();
  }

  public String getReason() {
    return reason;
  }
}
