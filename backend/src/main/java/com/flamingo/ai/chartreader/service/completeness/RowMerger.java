package com.flamingo.ai.chartreader.service.completeness;

import com.flamingo.ai.chartreader.service.extraction.ExtractedRow;
import com.flamingo.ai.chartreader.service.extraction.Ranks;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Adds rows found by a missing-rows pass without duplicating ranks. */
@Component
public class RowMerger {

  /**
   * Accepts an incoming row only when its chart has outstanding gaps, its rank is one of them and
   * no row with that rank exists yet. The result is sorted by chart discovery order, then rank,
   * with unranked rows last.
   */
  public MergeResult merge(
      List<ExtractedRow> existing, List<ExtractedRow> incoming, List<MissingChartGroup> missing) {
    Map<String, Set<Integer>> outstanding = new HashMap<>();
    for (MissingChartGroup group : missing) {
      outstanding.put(group.groupKey(), new HashSet<>(group.missingThisWeekRanks()));
    }

    Map<String, Set<Integer>> present = new HashMap<>();
    for (ExtractedRow row : existing) {
      Integer rank = Ranks.coerceRank(row.thisWeekRank());
      if (rank != null) {
        present.computeIfAbsent(row.groupKey(), k -> new HashSet<>()).add(rank);
      }
    }

    List<ExtractedRow> merged = new ArrayList<>(existing);
    int added = 0;
    for (ExtractedRow row : incoming) {
      Set<Integer> gaps = outstanding.get(row.groupKey());
      if (gaps == null || gaps.isEmpty()) {
        continue;
      }
      Integer rank = Ranks.coerceRank(row.thisWeekRank());
      if (rank == null || !gaps.contains(rank)) {
        continue;
      }
      Set<Integer> seen = present.computeIfAbsent(row.groupKey(), k -> new HashSet<>());
      if (!seen.add(rank)) {
        continue;
      }
      gaps.remove(rank);
      merged.add(row);
      added++;
    }

    Map<String, Integer> groupOrder = new LinkedHashMap<>();
    for (ExtractedRow row : merged) {
      groupOrder.putIfAbsent(row.groupKey(), groupOrder.size());
    }
    // List.sort is stable, so rows with equal keys keep their relative order.
    merged.sort(
        Comparator.comparingInt((ExtractedRow r) -> groupOrder.get(r.groupKey()))
            .thenComparingInt(RowMerger::rankOrLast));

    return new MergeResult(merged, added);
  }

  private static int rankOrLast(ExtractedRow row) {
    Integer rank = Ranks.coerceRank(row.thisWeekRank());
    return rank == null ? Integer.MAX_VALUE : rank;
  }
}
