package com.flamingo.ai.chartreader.domain.enums;

/** Outcome of a single extraction run. */
public enum RunStatus {
  COMPLETED,
  ERROR,
  CANCELLED
}
