package com.flamingo.ai.chartreader.domain.enums;

/** Where a job's source file currently lives. */
public enum FileLocation {
  /** Staging directory for unprocessed uploads. */
  NEW,

  /** Terminal storage after a successful run. */
  COMPLETED,

  /** Not found in either directory. */
  MISSING
}
