package com.flamingo.ai.chartreader.service.pdf;

/**
 * Chart-likeness of one page's text.
 *
 * @param baseScore keyword, rank-token and length contributions
 * @param preferenceBoost sub-genre header bonus, zero unless the page already looks chart-like
 * @param rankCount rank-like integers (1 to 200) found, capped
 * @param textLength length of the normalized text
 */
public record PageScore(double baseScore, double preferenceBoost, int rankCount, int textLength) {

  public static final PageScore EMPTY = new PageScore(0, 0, 0, 0);

  public double effectiveScore() {
    return baseScore + preferenceBoost;
  }

  public boolean isPreferred() {
    return preferenceBoost > 0;
  }
}
