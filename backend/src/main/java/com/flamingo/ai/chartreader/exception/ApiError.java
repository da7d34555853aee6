package com.flamingo.ai.chartreader.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String JOB_NOT_FOUND = "JOB_001";
  public static final String JOB_STATE_CONFLICT = "JOB_002";
  public static final String JOB_VALIDATION_ERROR = "JOB_003";
  public static final String EXTRACTION_UNAVAILABLE = "EXTRACTION_001";
  public static final String EXTRACTION_RATE_LIMITED = "EXTRACTION_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
