package com.flamingo.ai.chartreader.service.completeness;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.service.extraction.ExtractedRow;
import com.flamingo.ai.chartreader.service.extraction.Ranks;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds chart tables whose this-week ranks have gaps.
 *
 * <p>The expected size of a chart comes from its title ({@code DISCO TOP 80}), then from the
 * source filename ({@code 1979-03-10_top80.pdf}), then from the highest observed rank. An inferred
 * size outside the configured bounds is ignored in favour of the next source.
 */
@Component
public class CompletenessChecker {

  private final List<Pattern> titlePatterns;
  private final List<Pattern> filenamePatterns;
  private final int minExpectedRank;
  private final int maxExpectedRank;

  public CompletenessChecker(ChartReaderConfig config) {
    ChartReaderConfig.Completeness settings = config.getCompleteness();
    this.titlePatterns = settings.getTitlePatterns().stream().map(Pattern::compile).toList();
    this.filenamePatterns = settings.getFilenamePatterns().stream().map(Pattern::compile).toList();
    this.minExpectedRank = settings.getMinExpectedRank();
    this.maxExpectedRank = settings.getMaxExpectedRank();
  }

  /** Groups with gaps, in the order their charts first appear in {@code rows}. */
  public List<MissingChartGroup> findMissingGroups(
      List<ExtractedRow> rows, String sourceFilenameHint) {
    Map<String, List<ExtractedRow>> groups = new LinkedHashMap<>();
    for (ExtractedRow row : rows) {
      groups.computeIfAbsent(row.groupKey(), k -> new ArrayList<>()).add(row);
    }

    List<MissingChartGroup> missing = new ArrayList<>();
    for (List<ExtractedRow> groupRows : groups.values()) {
      ExtractedRow first = groupRows.get(0);
      Set<Integer> present = new HashSet<>();
      for (ExtractedRow row : groupRows) {
        Integer rank = Ranks.coerceRank(row.thisWeekRank());
        if (rank != null) {
          present.add(rank);
        }
      }
      if (present.isEmpty()) {
        continue;
      }

      int minRank = present.stream().mapToInt(Integer::intValue).min().getAsInt();
      int maxRank = present.stream().mapToInt(Integer::intValue).max().getAsInt();

      OptionalInt inferred = inferFrom(titlePatterns, first.chartTitle());
      if (inferred.isEmpty() && sourceFilenameHint != null) {
        inferred = inferFrom(filenamePatterns, sourceFilenameHint);
      }
      if (inferred.isEmpty()) {
        inferred = clamp(maxRank);
      }
      if (inferred.isEmpty()) {
        continue;
      }

      int expectedMax = Math.max(inferred.getAsInt(), maxRank);
      int expectedRows = expectedMax - minRank + 1;
      if (groupRows.size() >= expectedRows) {
        continue;
      }

      List<Integer> gaps = new ArrayList<>();
      for (int rank = minRank; rank <= expectedMax; rank++) {
        if (!present.contains(rank)) {
          gaps.add(rank);
        }
      }
      if (gaps.isEmpty()) {
        // Duplicate rows can make the count fall short of the span without any rank missing.
        continue;
      }

      missing.add(
          new MissingChartGroup(
              first.chartTitle(),
              first.chartSection(),
              expectedMax,
              minRank,
              maxRank,
              expectedRows,
              groupRows.size(),
              gaps));
    }
    return missing;
  }

  private OptionalInt inferFrom(List<Pattern> patterns, String text) {
    if (text == null || text.isBlank()) {
      return OptionalInt.empty();
    }
    for (Pattern pattern : patterns) {
      Matcher matcher = pattern.matcher(text.trim());
      if (matcher.find()) {
        return clamp(Integer.parseInt(matcher.group(1)));
      }
    }
    return OptionalInt.empty();
  }

  private OptionalInt clamp(int value) {
    return value < minExpectedRank || value > maxExpectedRank
        ? OptionalInt.empty()
        : OptionalInt.of(value);
  }
}
