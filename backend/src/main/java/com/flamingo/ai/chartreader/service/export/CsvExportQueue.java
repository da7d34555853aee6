package com.flamingo.ai.chartreader.service.export;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.service.event.JobEventPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs CSV re-exports one at a time, in request order.
 *
 * <p>A failed pass is reported to observers and does not stop later passes.
 */
@Component
@Slf4j
public class CsvExportQueue {

  private final ChartCsvExporter exporter;
  private final JobEventPublisher events;
  private final MeterRegistry meterRegistry;
  private final Executor csvExportExecutor;
  private final boolean enabled;

  public CsvExportQueue(
      ChartCsvExporter exporter,
      JobEventPublisher events,
      MeterRegistry meterRegistry,
      @Qualifier("csvExportExecutor") Executor csvExportExecutor,
      ChartReaderConfig config) {
    this.exporter = exporter;
    this.events = events;
    this.meterRegistry = meterRegistry;
    this.csvExportExecutor = csvExportExecutor;
    this.enabled = config.getCsv().isEnabled();
  }

  /** Schedules a pass; the future completes once it ran, successfully or not. */
  public CompletableFuture<Void> enqueue() {
    if (!enabled) {
      return CompletableFuture.completedFuture(null);
    }
    return CompletableFuture.runAsync(this::exportOnce, csvExportExecutor);
  }

  private void exportOnce() {
    try {
      CsvExportResult result = exporter.exportLatestRunsOnly();
      meterRegistry.counter("csv.export.success").increment();
      events.csvUpdated(result.updatedAt(), result.totalRowCount());
    } catch (Exception e) {
      log.error("CSV export failed: {}", e.getMessage(), e);
      meterRegistry.counter("csv.export.failure").increment();
      events.csvFailed(e.getMessage());
    }
  }
}
