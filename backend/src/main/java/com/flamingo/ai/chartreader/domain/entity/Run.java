package com.flamingo.ai.chartreader.domain.entity;

import com.flamingo.ai.chartreader.domain.enums.RunStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Outcome of one extraction attempt for a job, including the full attempt log for audit. */
@Entity
@Table(name = "runs", indexes = @Index(name = "idx_runs_job_id", columnList = "jobId"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Run {

  /** Assigned by the pipeline so rows can reference it before the insert is flushed. */
  @Id private UUID runId;

  @Column(nullable = false)
  private UUID jobId;

  @Column(nullable = false)
  private String model;

  @Column(nullable = false)
  private LocalDateTime extractedAt;

  private int rowsInserted;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String rawResultJson;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private RunStatus status = RunStatus.COMPLETED;

  @Column(columnDefinition = "TEXT")
  private String error;
}
