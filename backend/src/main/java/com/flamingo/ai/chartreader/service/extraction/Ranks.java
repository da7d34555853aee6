package com.flamingo.ai.chartreader.service.extraction;

import java.util.regex.Pattern;

/** Rank coercion shared by completeness checks and persistence. */
public final class Ranks {

  private static final Pattern NON_DIGIT = Pattern.compile("[^0-9]");

  private Ranks() {}

  /**
   * Keeps only the digits of a rank cell, so {@code "12*"} becomes 12 and {@code "NEW"} or
   * {@code "-"} become null.
   */
  public static Integer coerceRank(String value) {
    if (value == null) {
      return null;
    }
    String digits = NON_DIGIT.matcher(value.trim()).replaceAll("");
    if (digits.isEmpty()) {
      return null;
    }
    try {
      return Integer.valueOf(digits);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
