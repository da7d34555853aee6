package com.flamingo.ai.chartreader.api.dto.response;

import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.enums.FileLocation;
import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for job data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

  private UUID id;
  private String filename;
  private String canonicalFilename;
  private LocalDate entryDate;
  private JobStatus status;
  private String progressStep;
  private String error;
  private LocalDateTime createdAt;
  private LocalDateTime startedAt;
  private LocalDateTime finishedAt;
  private int runCount;
  private UUID lastRunId;
  private Integer rowsAppendedLastRun;
  private FileLocation fileLocation;
  private int versionCount;
  private String pendingFilename;
  private Integer selectedPage;
  private boolean pageConfirmed;
  private Integer pageCount;
  private List<Integer> candidatePages;

  /** Creates a JobResponse from a Job entity. */
  public static JobResponse fromEntity(Job job) {
    return JobResponse.builder()
        .id(job.getId())
        .filename(job.getFilename())
        .canonicalFilename(job.getCanonicalFilename())
        .entryDate(job.getEntryDate())
        .status(job.getStatus())
        .progressStep(job.getProgressStep())
        .error(job.getError())
        .createdAt(job.getCreatedAt())
        .startedAt(job.getStartedAt())
        .finishedAt(job.getFinishedAt())
        .runCount(job.getRunCount())
        .lastRunId(job.getLastRunId())
        .rowsAppendedLastRun(job.getRowsAppendedLastRun())
        .fileLocation(job.getFileLocation())
        .versionCount(job.getVersionCount())
        .pendingFilename(job.getPendingFilename())
        .selectedPage(job.getSelectedPage())
        .pageConfirmed(job.isPageConfirmed())
        .pageCount(job.getPageCount())
        .candidatePages(
            job.getCandidatePages() == null ? List.of() : List.copyOf(job.getCandidatePages()))
        .build();
  }
}
