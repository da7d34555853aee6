package com.flamingo.ai.chartreader.service.extraction;

/** What an extraction call asks the model for. */
public enum ExtractionMode {
  /** Every row of every chart table on the page. */
  FULL,

  /** Only the rows listed as missing from a previous attempt. */
  MISSING_ROWS
}
