package com.flamingo.ai.chartreader.service.completeness;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chartreader.service.extraction.ExtractedRow;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RowMerger Tests")
class RowMergerTest {

  private final RowMerger merger = new RowMerger();

  @Test
  @DisplayName("Should accept only outstanding ranks and never duplicate one")
  void shouldAddOnlyMissingRanks() {
    List<ExtractedRow> existing = List.of(row("A", "1"), row("A", "2"), row("A", "4"));
    List<MissingChartGroup> missing = List.of(gap("A", 3));
    List<ExtractedRow> incoming =
        List.of(row("A", "3"), row("A", "2"), row("B", "3"), row("A", "5"), row("A", "3"));

    MergeResult result = merger.merge(existing, incoming, missing);

    assertThat(result.rowsAdded()).isEqualTo(1);
    assertThat(result.merged())
        .extracting(ExtractedRow::thisWeekRank)
        .containsExactly("1", "2", "3", "4");
  }

  @Test
  void shouldIgnoreIncoming_whenNothingMissing() {
    List<ExtractedRow> existing = List.of(row("A", "1"));

    MergeResult result = merger.merge(existing, List.of(row("A", "2")), List.of());

    assertThat(result.rowsAdded()).isZero();
    assertThat(result.merged()).containsExactlyElementsOf(existing);
  }

  @Test
  @DisplayName("Should sort by chart order, then rank, unranked rows last")
  void shouldSortByGroupThenRank() {
    List<ExtractedRow> existing =
        List.of(row("B", "2"), row("A", null), row("A", "1"), row("B", "1"));
    List<MissingChartGroup> missing = List.of(gap("A", 2));

    MergeResult result = merger.merge(existing, List.of(row("A", "2")), missing);

    assertThat(result.merged())
        .extracting(r -> r.chartTitle() + ":" + r.thisWeekRank())
        .containsExactly("B:1", "B:2", "A:1", "A:2", "A:null");
  }

  private static ExtractedRow row(String chart, String rank) {
    return new ExtractedRow(chart, "", rank, null, null, null, "Song", "Artist", "Label");
  }

  private static MissingChartGroup gap(String chart, int... ranks) {
    List<Integer> list = Arrays.stream(ranks).boxed().toList();
    return new MissingChartGroup(chart, "", 5, 1, 5, 5, 5 - list.size(), list);
  }
}
