package com.flamingo.ai.chartreader.api.dto.response;

import com.flamingo.ai.chartreader.domain.entity.Run;
import com.flamingo.ai.chartreader.domain.enums.RunStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for run data, including the raw attempt log. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResponse {

  private UUID runId;
  private UUID jobId;
  private String model;
  private LocalDateTime extractedAt;
  private int rowsInserted;
  private RunStatus status;
  private String error;
  private String rawResultJson;

  public static RunResponse fromEntity(Run run) {
    return RunResponse.builder()
        .runId(run.getRunId())
        .jobId(run.getJobId())
        .model(run.getModel())
        .extractedAt(run.getExtractedAt())
        .rowsInserted(run.getRowsInserted())
        .status(run.getStatus())
        .error(run.getError())
        .rawResultJson(run.getRawResultJson())
        .build();
  }
}
