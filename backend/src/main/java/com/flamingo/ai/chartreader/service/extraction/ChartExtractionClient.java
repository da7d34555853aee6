package com.flamingo.ai.chartreader.service.extraction;

import com.flamingo.ai.chartreader.service.completeness.MissingChartGroup;
import com.flamingo.ai.chartreader.service.worker.CancellationToken;
import java.util.List;

/** Reads chart rows from a page image with a vision-language model. */
public interface ChartExtractionClient {

  /**
   * Extracts rows from the image.
   *
   * @param model model id to use for this call
   * @param mode {@link ExtractionMode#MISSING_ROWS} asks only for the ranks listed in {@code
   *     missing}
   * @param missing gaps from the previous attempt; ignored in {@link ExtractionMode#FULL}
   * @param token aborts the remote call when fired
   * @throws com.flamingo.ai.chartreader.exception.ChartExtractionException on remote failure or
   *     unusable output
   * @throws com.flamingo.ai.chartreader.exception.JobCancelledException when the token fires
   */
  ExtractionResult extract(
      ModelImage image,
      String model,
      ExtractionMode mode,
      List<MissingChartGroup> missing,
      CancellationToken token);
}
