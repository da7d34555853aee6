package com.flamingo.ai.chartreader.service.extraction;

import com.flamingo.ai.chartreader.exception.ChartExtractionException;
import java.util.function.Predicate;

/**
 * Retry predicate for the {@code chartExtraction} instance: only remote call failures are retried,
 * never malformed output or cancellation.
 */
public class RetryableExtractionFailure implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    return throwable instanceof ChartExtractionException extraction && extraction.isRetryable();
  }
}
