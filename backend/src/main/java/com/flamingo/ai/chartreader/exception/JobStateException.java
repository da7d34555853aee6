package com.flamingo.ai.chartreader.exception;

import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import java.util.Locale;
import java.util.UUID;

/** Exception thrown when an operation is not allowed in the job's current status. */
public class JobStateException extends RuntimeException {

  private final UUID jobId;
  private final JobStatus status;
  private final String userMessage;

  public JobStateException(UUID jobId, JobStatus status, String userMessage) {
    super("Job " + jobId + " is " + status.name().toLowerCase(Locale.ROOT) + ": " + userMessage);
    this.jobId = jobId;
    this.status = status;
    this.userMessage = userMessage;
  }

  public UUID getJobId() {
    return jobId;
  }

  public JobStatus getStatus() {
    return status;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
