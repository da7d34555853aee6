package com.flamingo.ai.chartreader.api.dto.response;

import com.flamingo.ai.chartreader.domain.entity.ChartRow;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one extracted chart row. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartRowResponse {

  private Long id;
  private UUID runId;
  private UUID jobId;
  private LocalDate entryDate;
  private String chartTitle;
  private String chartSection;
  private Integer thisWeekRank;
  private Integer lastWeekRank;
  private Integer twoWeeksAgoRank;
  private Integer weeksOnChart;
  private String title;
  private String artist;
  private String label;
  private String sourceFile;
  private LocalDateTime extractedAt;

  public static ChartRowResponse fromEntity(ChartRow row) {
    return ChartRowResponse.builder()
        .id(row.getId())
        .runId(row.getRunId())
        .jobId(row.getJobId())
        .entryDate(row.getEntryDate())
        .chartTitle(row.getChartTitle())
        .chartSection(row.getChartSection())
        .thisWeekRank(row.getThisWeekRank())
        .lastWeekRank(row.getLastWeekRank())
        .twoWeeksAgoRank(row.getTwoWeeksAgoRank())
        .weeksOnChart(row.getWeeksOnChart())
        .title(row.getTitle())
        .artist(row.getArtist())
        .label(row.getLabel())
        .sourceFile(row.getSourceFile())
        .extractedAt(row.getExtractedAt())
        .build();
  }
}
