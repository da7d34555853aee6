package com.flamingo.ai.chartreader.domain.entity;

import com.flamingo.ai.chartreader.domain.converter.IntegerListConverter;
import com.flamingo.ai.chartreader.domain.enums.FileLocation;
import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

/**
 * One physical chart document under management.
 *
 * <p>Saves write only the changed columns. Status transitions that race with the worker go through
 * the conditional updates of {@code JobRepository}.
 */
@Entity
@DynamicUpdate
@Table(
    name = "jobs",
    indexes = {
      @Index(name = "idx_jobs_status_created", columnList = "status, createdAt"),
      @Index(name = "idx_jobs_canonical_filename", columnList = "canonicalFilename")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true)
  private String filename;

  /** Version-stable identity used to merge re-uploads of the same document. */
  @Column(nullable = false)
  private String canonicalFilename;

  /** Parsed from the filename; never changed once set. */
  private LocalDate entryDate;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private JobStatus status = JobStatus.QUEUED;

  private String progressStep;

  @Column(columnDefinition = "TEXT")
  private String error;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime startedAt;

  private LocalDateTime finishedAt;

  @Builder.Default private int runCount = 0;

  private UUID lastRunId;

  private Integer rowsAppendedLastRun;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private FileLocation fileLocation = FileLocation.NEW;

  @Builder.Default private int versionCount = 1;

  /** Newer upload of the same document that arrived while this job was busy. */
  private String pendingFilename;

  /** PDF page to extract (1-based); the scanner's first choice until the operator confirms. */
  private Integer selectedPage;

  /** Whether a human confirmed {@link #selectedPage}; unconfirmed PDFs suspend for review. */
  @Builder.Default private boolean pageConfirmed = false;

  private Integer pageCount;

  @Convert(converter = IntegerListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<Integer> candidatePages = new ArrayList<>();

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  /** Puts the job back in the queue, clearing the outcome of the previous attempt. */
  public void requeue() {
    this.status = JobStatus.QUEUED;
    this.progressStep = null;
    this.error = null;
    this.startedAt = null;
    this.finishedAt = null;
  }

  /** Forgets the PDF page choice so the next run rescans the document. */
  public void resetPageSelection() {
    this.selectedPage = null;
    this.pageConfirmed = false;
    this.pageCount = null;
    this.candidatePages = new ArrayList<>();
  }

  /** Marks the job failed with a message shown to the operator. */
  public void markFailed(String errorMessage) {
    this.status = JobStatus.ERROR;
    this.progressStep = "error";
    this.error = errorMessage;
    this.finishedAt = LocalDateTime.now();
  }

  /** Marks the job cancelled, keeping the current progress step visible. */
  public void markCancelled(String reason) {
    this.status = JobStatus.CANCELLED;
    this.error = reason;
    this.finishedAt = LocalDateTime.now();
  }
}
