package com.flamingo.ai.chartreader.domain.enums;

/** Lifecycle status of an extraction job. */
public enum JobStatus {
  /** Waiting for a free worker slot. */
  QUEUED,

  /** Claimed by the worker and running through the pipeline. */
  PROCESSING,

  /** PDF page candidates are stored and a human must confirm the page to extract. */
  AWAITING_REVIEW,

  /** Rows were extracted and persisted. */
  COMPLETED,

  /** The last run failed or finished with gaps. */
  ERROR,

  /** Stopped on request. */
  CANCELLED,

  /** Removed from the queue; rows are kept. */
  DELETED;

  /** Whether the job can still be picked up or is being worked on. */
  public boolean isActive() {
    return this == QUEUED || this == PROCESSING || this == AWAITING_REVIEW;
  }
}
