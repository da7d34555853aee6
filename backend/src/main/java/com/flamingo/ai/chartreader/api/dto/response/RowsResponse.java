package com.flamingo.ai.chartreader.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One slice of extracted rows plus the total row count. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RowsResponse {

  private List<ChartRowResponse> rows;
  private long total;
}
