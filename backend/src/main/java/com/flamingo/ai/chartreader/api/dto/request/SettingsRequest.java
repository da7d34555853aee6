package com.flamingo.ai.chartreader.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for updating the worker settings; null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsRequest {

  @Min(value = 1, message = "concurrency must be between 1 and 10")
  @Max(value = 10, message = "concurrency must be between 1 and 10")
  private Integer concurrency;

  private Boolean paused;

  @Size(min = 1, max = 100, message = "model must be between 1 and 100 characters")
  private String model;
}
