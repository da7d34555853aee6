package com.flamingo.ai.chartreader.service.extraction;

import com.flamingo.ai.chartreader.service.completeness.MissingChartGroup;
import com.flamingo.ai.chartreader.service.completeness.RankRanges;
import java.util.List;

/** Instructions sent with the page image. */
final class ExtractionPrompts {

  static final String SYSTEM =
      """
      You are a high-precision OCR and table extraction engine for scanned Billboard chart pages.
      Return only a JSON object, with no commentary and no markdown.
      Never guess: if a rank cannot be read confidently use null, and if a title, artist or label
      cannot be read confidently omit the row.
      Never mix data across different chart tables on the same page.
      """;

  private static final String ROW_FORMAT =
      """
      Output format: {"rows": [ ... ]} where each row is an object with the string fields
      chartTitle, chartSection, thisWeekRank, lastWeekRank, twoWeeksAgoRank, weeksOnChart, title,
      artist, label. Rank fields may be null.
      """;

  private static final String FULL =
      """
      Extract every chart table row from this scanned Billboard page.

      %s
      Terminology:
      - A chart block is one chart table with its own title and column headers. A page can hold
        several chart blocks.
      - chartTitle is the chart block's own title, e.g. "12 INCH SINGLES SALES", "CLUB PLAY" or
        "DISCO TOP 80". Do not include the Billboard masthead.
      - chartSection is the page header that groups charts, e.g. "HOT DANCE/DISCO", or "" when
        there is none.

      Rules:
      1) Treat chart blocks as separate tables. Never copy ranks from one block onto rows of
         another, even when the rows line up horizontally. A chart continued in a second column is
         still one chart, but never combine cells across columns.
      2) Ranks come only from the columns of the row's own chart block. Ignore stars, circles and
         bullets printed near them. Blank cells, dashes, "NEW" and unreadable cells are null.
         Return digits only, e.g. "12", not "12*" or "(12)".
      3) Copy title, artist and label from the same row of the same block. Drop trailing
         separator dashes and decorative symbols.
      4) Extract only chart table rows. Ignore articles, ads and sidebars.

      Keep rows top to bottom within each table and output tables in reading order.
      """;

  private static final String MISSING =
      """
      Rows were extracted from this scanned Billboard page earlier, but some were missed. Use the
      ranks you can read clearly and the chart titles and sections to locate them.

      %s
      Output ONLY the missing rows listed below. Do not repeat ranks that were already extracted.
      Every row must carry the chartTitle and chartSection of its own chart block. Omit any row you
      cannot read confidently.

      Missing rows:
      %s
      """;

  private ExtractionPrompts() {}

  static String userPrompt(ExtractionMode mode, List<MissingChartGroup> missing, int maxRanges) {
    if (mode == ExtractionMode.FULL) {
      return FULL.formatted(ROW_FORMAT);
    }
    return MISSING.formatted(ROW_FORMAT, describeMissing(missing, maxRanges));
  }

  static String describeMissing(List<MissingChartGroup> missing, int maxRanges) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < missing.size(); i++) {
      MissingChartGroup group = missing.get(i);
      String label = group.chartTitle().isEmpty() ? "(unknown chart)" : group.chartTitle();
      if (!group.chartSection().isEmpty()) {
        label += " [" + group.chartSection() + "]";
      }
      String ranks = RankRanges.format(group.missingThisWeekRanks(), maxRanges);
      text.append(i + 1)
          .append(") ")
          .append(label)
          .append(": extracted ")
          .append(group.actualRowCount())
          .append('/')
          .append(group.expectedRowCount())
          .append("; missing thisWeekRank ")
          .append(ranks.isEmpty() ? "(unknown)" : ranks)
          .append('\n');
    }
    return text.toString();
  }
}
