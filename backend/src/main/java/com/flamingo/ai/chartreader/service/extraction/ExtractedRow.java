package com.flamingo.ai.chartreader.service.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One chart entry as read by the model. Rank fields hold digits only, or null.
 *
 * @param chartTitle the chart table's own title, e.g. {@code CLUB PLAY}
 * @param chartSection page header grouping several charts; empty when there is none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedRow(
    String chartTitle,
    String chartSection,
    String thisWeekRank,
    String lastWeekRank,
    String twoWeeksAgoRank,
    String weeksOnChart,
    String title,
    String artist,
    String label) {

  /** Key of the chart table the row belongs to. */
  public String groupKey() {
    return groupKey(chartSection, chartTitle);
  }

  public static String groupKey(String chartSection, String chartTitle) {
    return (chartSection == null ? "" : chartSection)
        + "|||"
        + (chartTitle == null ? "" : chartTitle);
  }

  /** Text fields normalized, rank fields reduced to digits; null when a required field is empty. */
  ExtractedRow normalized() {
    ExtractedRow row =
        new ExtractedRow(
            ExtractedTextNormalizer.normalizeText(chartTitle),
            ExtractedTextNormalizer.normalizeText(chartSection),
            ExtractedTextNormalizer.normalizeRank(thisWeekRank),
            ExtractedTextNormalizer.normalizeRank(lastWeekRank),
            ExtractedTextNormalizer.normalizeRank(twoWeeksAgoRank),
            ExtractedTextNormalizer.normalizeRank(weeksOnChart),
            ExtractedTextNormalizer.normalizeText(title),
            ExtractedTextNormalizer.normalizeText(artist),
            ExtractedTextNormalizer.normalizeText(label));
    boolean complete =
        !row.chartTitle.isEmpty()
            && !row.title.isEmpty()
            && !row.artist.isEmpty()
            && !row.label.isEmpty();
    return complete ? row : null;
  }
}
