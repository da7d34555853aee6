package com.flamingo.ai.chartreader.service.extraction;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keeps only the rows of the chart family this deployment collects.
 *
 * <p>A matching section header keeps every chart under it. Without one, charts are kept by title.
 * Rows of unrelated charts printed on the same page are dropped.
 */
@Component
@Slf4j
public class ChartRelevanceFilter {

  /** How the kept rows were matched. */
  public enum Mode {
    SECTION,
    TITLE,
    NONE,
    DISABLED
  }

  /**
   * @param mode how rows were matched
   * @param rows kept rows in input order
   * @param matchedSections section headers that matched, in first-seen order
   */
  public record Result(Mode mode, List<ExtractedRow> rows, List<String> matchedSections) {}

  private final ChartReaderConfig.Extraction.ChartFilter settings;
  private final List<Pattern> sectionPatterns;
  private final List<Pattern> titlePatterns;

  public ChartRelevanceFilter(ChartReaderConfig config) {
    this.settings = config.getExtraction().getChartFilter();
    this.sectionPatterns = settings.getSectionPatterns().stream().map(Pattern::compile).toList();
    this.titlePatterns = settings.getTitlePatterns().stream().map(Pattern::compile).toList();
  }

  public Result filter(List<ExtractedRow> rows) {
    if (!settings.isEnabled()) {
      return new Result(Mode.DISABLED, rows, List.of());
    }

    Map<String, ExtractedRow> firstRowByGroup = new LinkedHashMap<>();
    for (ExtractedRow row : rows) {
      firstRowByGroup.putIfAbsent(row.groupKey(), row);
    }

    Set<String> matchedSections = new LinkedHashSet<>();
    for (ExtractedRow first : firstRowByGroup.values()) {
      if (matchesAny(sectionPatterns, first.chartSection())) {
        matchedSections.add(first.chartSection());
      }
    }
    if (!matchedSections.isEmpty()) {
      List<ExtractedRow> kept =
          rows.stream().filter(r -> matchedSections.contains(r.chartSection())).toList();
      log.debug("Kept {} of {} rows by section {}", kept.size(), rows.size(), matchedSections);
      return new Result(Mode.SECTION, kept, List.copyOf(matchedSections));
    }

    Set<String> matchedGroups = new LinkedHashSet<>();
    for (Map.Entry<String, ExtractedRow> entry : firstRowByGroup.entrySet()) {
      if (matchesAny(titlePatterns, entry.getValue().chartTitle())) {
        matchedGroups.add(entry.getKey());
      }
    }
    if (!matchedGroups.isEmpty()) {
      List<ExtractedRow> kept =
          rows.stream().filter(r -> matchedGroups.contains(r.groupKey())).toList();
      log.debug("Kept {} of {} rows by chart title", kept.size(), rows.size());
      return new Result(Mode.TITLE, kept, List.of());
    }

    return new Result(Mode.NONE, List.of(), List.of());
  }

  /** Label of the collected chart family for operator-facing messages. */
  public String describe() {
    return settings.getDescription();
  }

  private static boolean matchesAny(List<Pattern> patterns, String value) {
    if (value == null || value.isBlank()) {
      return false;
    }
    String text = value.replaceAll("\\s+", " ").trim();
    for (Pattern pattern : patterns) {
      if (pattern.matcher(text).find()) {
        return true;
      }
    }
    return false;
  }
}
