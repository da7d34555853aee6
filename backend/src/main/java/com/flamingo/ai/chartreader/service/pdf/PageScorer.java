package com.flamingo.ai.chartreader.service.pdf;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Scores a page's extracted text for how likely it holds a chart table.
 *
 * <p>The base score rewards chart column headers and rank-like numbers. Pages that already look
 * chart-like additionally earn a preference boost for dance/disco chart headers, so that such a
 * page beats other chart pages (rock, country) in the same issue.
 */
@Component
public class PageScorer {

  static final int RANK_TOKEN_CAP = 300;
  static final double RANK_TOKEN_WEIGHT = 0.45;
  static final double MAX_LENGTH_BONUS = 40;
  static final double LENGTH_BONUS_DIVISOR = 1000;

  // Boost gate: base and rank count must both fall short for the boost to be withheld.
  static final double BOOST_GATE_BASE = 140;
  static final int BOOST_GATE_RANKS = 18;

  static final double CHART_BASE_THRESHOLD = 160;
  static final int CHART_RANK_THRESHOLD = 30;
  static final double CHART_MIXED_BASE_THRESHOLD = 110;
  static final int CHART_MIXED_RANK_THRESHOLD = 18;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern RANK_TOKEN = Pattern.compile("\\b\\d{1,3}\\b");

  private static final String PAIR =
      "(?:dance(?:\\s*music)?|disco)\\s*(?:/|&|and|\\+|-)\\s*(?:disco|dance(?:\\s*music)?)";

  private static final List<WeightedPattern> HEADER_PATTERNS =
      List.of(
          new WeightedPattern("\\bthis\\s*week\\b", 70, 2),
          new WeightedPattern("\\blast\\s*week\\b", 60, 2),
          new WeightedPattern("\\btwo\\s*weeks?\\s*ago\\b", 45, 2),
          new WeightedPattern("\\bweeks?\\s*on\\s*chart\\b", 85, 2),
          new WeightedPattern("\\bwks?\\s*on\\s*chart\\b", 85, 2),
          new WeightedPattern("\\bpeak\\s*position\\b", 35, 2),
          new WeightedPattern("\\bbillboard\\b", 18, 4),
          new WeightedPattern("\\bchart\\b", 12, 6),
          new WeightedPattern("\\bartist\\b", 14, 6),
          new WeightedPattern("\\btitle\\b", 14, 6),
          new WeightedPattern("\\blabel\\b", 14, 6),
          new WeightedPattern("\\bhot\\s*100\\b", 28, 2));

  private static final List<WeightedPattern> PREFERENCE_PATTERNS =
      List.of(
          // Most specific chart titles and section headers.
          new WeightedPattern("\\bclub\\s*play\\b", 5200, 2),
          new WeightedPattern("\\bhot\\s*" + PAIR + "\\b", 5600, 2),
          new WeightedPattern("\\b" + PAIR + "\\s*top\\s*\\d{2,3}\\b", 5600, 2),
          new WeightedPattern("\\bdisco\\s*top\\s*\\d{2,3}\\b", 5600, 2),
          // Same headers when the number was lost in the text layer.
          new WeightedPattern("\\b" + PAIR + "\\s*top\\b(?!\\s*\\d{2,3}\\b)", 4200, 2),
          new WeightedPattern("\\bdisco\\s*top\\b(?!\\s*\\d{2,3}\\b)", 4200, 2),
          new WeightedPattern("\\b" + PAIR + "\\b", 1800, 3),
          // Ancillary chart titles.
          new WeightedPattern("\\b12\\s*inch\\b", 900, 2),
          new WeightedPattern("\\b12\\s*in\\.\\b", 900, 2));

  /** Scores raw page text; blank text scores zero everywhere. */
  public PageScore score(String rawText) {
    if (rawText == null) {
      return PageScore.EMPTY;
    }
    String text = WHITESPACE.matcher(rawText).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    if (text.isEmpty()) {
      return PageScore.EMPTY;
    }

    double base = 0;
    for (WeightedPattern header : HEADER_PATTERNS) {
      base += header.score(text);
    }

    int rankCount = countRankTokens(text);
    base += Math.min(RANK_TOKEN_CAP, rankCount) * RANK_TOKEN_WEIGHT;
    base += Math.min(MAX_LENGTH_BONUS, text.length() / LENGTH_BONUS_DIVISOR);

    double boost = 0;
    if (base >= BOOST_GATE_BASE || rankCount >= BOOST_GATE_RANKS) {
      for (WeightedPattern preference : PREFERENCE_PATTERNS) {
        boost += preference.score(text);
      }
    }

    return new PageScore(base, boost, rankCount, text.length());
  }

  public boolean looksLikeChartPage(PageScore score) {
    return score.baseScore() >= CHART_BASE_THRESHOLD
        || score.rankCount() >= CHART_RANK_THRESHOLD
        || (score.baseScore() >= CHART_MIXED_BASE_THRESHOLD
            && score.rankCount() >= CHART_MIXED_RANK_THRESHOLD);
  }

  private static int countRankTokens(String text) {
    Matcher matcher = RANK_TOKEN.matcher(text);
    int count = 0;
    while (matcher.find() && count < RANK_TOKEN_CAP) {
      int value = Integer.parseInt(matcher.group());
      if (value >= 1 && value <= 200) {
        count++;
      }
    }
    return count;
  }

  private record WeightedPattern(Pattern pattern, double weight, int cap) {

    WeightedPattern(String regex, double weight, int cap) {
      this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), weight, cap);
    }

    double score(String text) {
      Matcher matcher = pattern.matcher(text);
      int hits = 0;
      while (hits < cap && matcher.find()) {
        hits++;
      }
      return hits * weight;
    }
  }
}
