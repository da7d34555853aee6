package com.flamingo.ai.chartreader.service.completeness;

import com.flamingo.ai.chartreader.service.extraction.ExtractedRow;
import java.util.List;

/**
 * @param merged existing rows plus the accepted incoming rows, sorted
 * @param rowsAdded number of incoming rows accepted
 */
public record MergeResult(List<ExtractedRow> merged, int rowsAdded) {}
