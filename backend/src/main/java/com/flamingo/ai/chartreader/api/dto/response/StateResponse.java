package com.flamingo.ai.chartreader.api.dto.response;

import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Snapshot sent on page load and as the first event of every stream. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateResponse {

  private SettingsResponse settings;
  private List<JobResponse> jobs;
  private int activeJobs;

  public static StateResponse of(WorkerSettings settings, List<Job> jobs, int activeJobs) {
    return StateResponse.builder()
        .settings(SettingsResponse.fromEntity(settings))
        .jobs(jobs.stream().map(JobResponse::fromEntity).toList())
        .activeJobs(activeJobs)
        .build();
  }
}
