package com.flamingo.ai.chartreader.service.completeness;

import com.flamingo.ai.chartreader.service.extraction.ExtractedRow;
import java.util.List;

/**
 * A chart table whose this-week ranks have gaps.
 *
 * @param expectedMaxRank highest rank the chart should reach
 * @param minRank lowest rank observed
 * @param maxRank highest rank observed
 * @param expectedRowCount rows between {@code minRank} and {@code expectedMaxRank}, inclusive
 * @param actualRowCount rows extracted for the chart
 * @param missingThisWeekRanks ascending ranks not observed
 */
public record MissingChartGroup(
    String chartTitle,
    String chartSection,
    int expectedMaxRank,
    int minRank,
    int maxRank,
    int expectedRowCount,
    int actualRowCount,
    List<Integer> missingThisWeekRanks) {

  public MissingChartGroup {
    missingThisWeekRanks = List.copyOf(missingThisWeekRanks);
  }

  public String groupKey() {
    return ExtractedRow.groupKey(chartSection, chartTitle);
  }
}
