package com.flamingo.ai.chartreader.service.completeness;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.service.extraction.ExtractedRow;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CompletenessChecker Tests")
class CompletenessCheckerTest {

  private CompletenessChecker checker;

  @BeforeEach
  void setUp() {
    checker = new CompletenessChecker(new ChartReaderConfig());
  }

  @Test
  @DisplayName("Should report exactly the missing rank inside the observed span")
  void shouldReportMissingRank_whenRankSkipped() {
    List<ExtractedRow> rows =
        List.of(
            row("CLUB PLAY", "1"),
            row("CLUB PLAY", "2"),
            row("CLUB PLAY", "4"),
            row("CLUB PLAY", "5"));

    List<MissingChartGroup> missing = checker.findMissingGroups(rows, null);

    assertThat(missing).hasSize(1);
    MissingChartGroup group = missing.get(0);
    assertThat(group.chartTitle()).isEqualTo("CLUB PLAY");
    assertThat(group.expectedMaxRank()).isEqualTo(5);
    assertThat(group.expectedRowCount()).isEqualTo(5);
    assertThat(group.actualRowCount()).isEqualTo(4);
    assertThat(group.missingThisWeekRanks()).containsExactly(3);
  }

  @Test
  @DisplayName("Should take the expected size from the chart title")
  void shouldUseTitleSize_whenTitleNamesIt() {
    List<ExtractedRow> rows = ranks("DISCO TOP 80", 1, 10);

    List<MissingChartGroup> missing = checker.findMissingGroups(rows, null);

    assertThat(missing).hasSize(1);
    assertThat(missing.get(0).expectedMaxRank()).isEqualTo(80);
    assertThat(missing.get(0).missingThisWeekRanks()).hasSize(70).startsWith(11).endsWith(80);
  }

  @Test
  @DisplayName("Should fall back to the size in the filename")
  void shouldUseFilenameSize_whenTitleHasNone() {
    List<ExtractedRow> rows = ranks("CLUB PLAY", 1, 10);

    List<MissingChartGroup> missing = checker.findMissingGroups(rows, "1979-03-10_top15.pdf");

    assertThat(missing).hasSize(1);
    assertThat(missing.get(0).missingThisWeekRanks()).containsExactly(11, 12, 13, 14, 15);
  }

  @Test
  void shouldIgnoreTitleSize_whenOutsideBounds() {
    List<ExtractedRow> rows = ranks("TOP 999", 1, 3);

    assertThat(checker.findMissingGroups(rows, null)).isEmpty();
  }

  @Test
  void shouldReportNothing_whenChartComplete() {
    assertThat(checker.findMissingGroups(ranks("DISCO TOP 10", 1, 10), null)).isEmpty();
  }

  @Test
  void shouldSkipGroup_whenNoNumericRanks() {
    List<ExtractedRow> rows = List.of(row("HOT DISCO", "NEW"), row("HOT DISCO", null));

    assertThat(checker.findMissingGroups(rows, null)).isEmpty();
  }

  @Test
  @DisplayName("Should list groups in the order their charts appear")
  void shouldKeepDiscoveryOrder() {
    List<ExtractedRow> rows = new ArrayList<>();
    rows.add(row("B CHART", "1"));
    rows.add(row("A CHART", "1"));
    rows.add(row("B CHART", "3"));
    rows.add(row("A CHART", "3"));

    List<MissingChartGroup> missing = checker.findMissingGroups(rows, null);

    assertThat(missing)
        .extracting(MissingChartGroup::chartTitle)
        .containsExactly("B CHART", "A CHART");
  }

  private static List<ExtractedRow> ranks(String chartTitle, int from, int to) {
    return IntStream.rangeClosed(from, to)
        .mapToObj(rank -> row(chartTitle, String.valueOf(rank)))
        .toList();
  }

  static ExtractedRow row(String chartTitle, String rank) {
    return new ExtractedRow(
        chartTitle, "", rank, null, null, null, "Song " + rank, "Artist", "Label");
  }
}
