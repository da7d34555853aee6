package com.flamingo.ai.chartreader.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for confirming the PDF page to extract. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmPageRequest {

  @NotNull(message = "page is required")
  @Min(value = 1, message = "page must be 1 or greater")
  private Integer page;
}
