package com.flamingo.ai.chartreader.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One extracted chart table entry, owned by a run. */
@Entity
@Table(
    name = "chart_rows",
    indexes = {
      @Index(name = "idx_chart_rows_job_id", columnList = "jobId"),
      @Index(name = "idx_chart_rows_run_id", columnList = "runId")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChartRow {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private UUID runId;

  @Column(nullable = false)
  private UUID jobId;

  @Column(nullable = false)
  private LocalDate entryDate;

  @Column(nullable = false)
  private String chartTitle;

  @Column(nullable = false)
  private String chartSection;

  private Integer thisWeekRank;

  private Integer lastWeekRank;

  private Integer twoWeeksAgoRank;

  private Integer weeksOnChart;

  @Column(nullable = false)
  private String title;

  @Column(nullable = false)
  private String artist;

  @Column(nullable = false)
  private String label;

  @Column(nullable = false)
  private String sourceFile;

  @Column(nullable = false)
  private LocalDateTime extractedAt;
}
