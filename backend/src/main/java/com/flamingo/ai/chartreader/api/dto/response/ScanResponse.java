package com.flamingo.ai.chartreader.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanResponse {

  private int created;
  private List<JobResponse> jobs;
}
