package com.flamingo.ai.chartreader.api.dto.response;

import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the worker settings. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsResponse {

  private int concurrency;
  private boolean paused;
  private String model;

  public static SettingsResponse fromEntity(WorkerSettings settings) {
    return SettingsResponse.builder()
        .concurrency(settings.getConcurrency())
        .paused(settings.isPaused())
        .model(settings.getModel())
        .build();
  }
}
