package com.flamingo.ai.chartreader.service.extraction;

import java.util.Locale;
import java.util.regex.Pattern;

/** Cleans OCR text read from chart tables. */
public final class ExtractedTextNormalizer {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final String DECORATION =
      "[\\s*\\u2605\\u2606\\u2022\\u25CF\\u25CB\\u25C6\\u2666\\u25E6\\u25AA]+";
  private static final Pattern EDGE_DECORATION =
      Pattern.compile("^" + DECORATION + "|" + DECORATION + "$");
  private static final Pattern TRAILING_DASH =
      Pattern.compile("[\\u2010\\u2011\\u2012\\u2013\\u2014\\u2212-]+$");
  private static final Pattern NON_DIGIT = Pattern.compile("[^0-9]");

  private ExtractedTextNormalizer() {}

  /** Collapses whitespace, strips stars and bullets at the edges and trailing separator dashes. */
  public static String normalizeText(String value) {
    if (value == null) {
      return "";
    }
    String text = WHITESPACE.matcher(value).replaceAll(" ").trim();
    if (text.isEmpty()) {
      return "";
    }
    text = EDGE_DECORATION.matcher(text).replaceAll("").trim();
    text = TRAILING_DASH.matcher(text).replaceAll("").trim();
    return text;
  }

  /** Digits of a rank cell; null for blanks, dashes and {@code NEW}. */
  public static String normalizeRank(String value) {
    if (value == null) {
      return null;
    }
    String text = normalizeText(value);
    if (text.isEmpty() || "NEW".equals(text.toUpperCase(Locale.ROOT))) {
      return null;
    }
    String digits = NON_DIGIT.matcher(text).replaceAll("");
    return digits.isEmpty() ? null : digits;
  }
}
