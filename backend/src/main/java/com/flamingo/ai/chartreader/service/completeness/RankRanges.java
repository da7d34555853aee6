package com.flamingo.ai.chartreader.service.completeness;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/** Compact rendering of rank sets such as {@code 1-3, 7, 9-10}. */
public final class RankRanges {

  private RankRanges() {}

  /**
   * Formats distinct ranks as ascending ranges, keeping at most {@code maxRanges} of them and
   * appending {@code , …} when some were cut.
   */
  public static String format(Collection<Integer> ranks, int maxRanges) {
    int limit = Math.max(1, maxRanges);
    TreeSet<Integer> sorted = new TreeSet<>();
    for (Integer rank : ranks) {
      if (rank != null) {
        sorted.add(rank);
      }
    }
    if (sorted.isEmpty()) {
      return "";
    }

    List<int[]> ranges = new ArrayList<>();
    for (int rank : sorted) {
      int[] last = ranges.isEmpty() ? null : ranges.get(ranges.size() - 1);
      if (last == null || rank > last[1] + 1) {
        ranges.add(new int[] {rank, rank});
      } else {
        last[1] = rank;
      }
    }

    StringBuilder text = new StringBuilder();
    for (int i = 0; i < Math.min(limit, ranges.size()); i++) {
      int[] range = ranges.get(i);
      if (i > 0) {
        text.append(", ");
      }
      text.append(range[0]);
      if (range[1] != range[0]) {
        text.append('-').append(range[1]);
      }
    }
    if (ranges.size() > limit) {
      text.append(", …");
    }
    return text.toString();
  }
}
