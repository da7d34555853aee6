package com.flamingo.ai.chartreader.service.export;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.service.event.JobEventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CsvExportQueueTest {

  @Mock private ChartCsvExporter exporter;
  @Mock private JobEventPublisher events;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private ChartReaderConfig config;

  @BeforeEach
  void setUp() {
    config = new ChartReaderConfig();
    when(meterRegistry.counter(anyString())).thenReturn(counter);
  }

  @Test
  void shouldPublishUpdate_whenExportSucceeds() throws Exception {
    when(exporter.exportLatestRunsOnly())
        .thenReturn(new CsvExportResult("2024-03-01T12:00:00Z", 42));

    queue().enqueue().join();

    verify(events).csvUpdated("2024-03-01T12:00:00Z", 42);
    verify(events, never()).csvFailed(anyString());
  }

  @Test
  void shouldPublishFailure_andKeepAccepting_whenExportFails() throws Exception {
    when(exporter.exportLatestRunsOnly())
        .thenThrow(new IOException("disk full"))
        .thenReturn(new CsvExportResult("2024-03-01T12:00:00Z", 1));
    CsvExportQueue queue = queue();

    queue.enqueue().join();
    queue.enqueue().join();

    verify(events).csvFailed("disk full");
    verify(events).csvUpdated("2024-03-01T12:00:00Z", 1);
  }

  @Test
  void shouldSkip_whenDisabled() {
    config.getCsv().setEnabled(false);

    queue().enqueue().join();

    verifyNoInteractions(exporter, events);
  }

  private CsvExportQueue queue() {
    return new CsvExportQueue(exporter, events, meterRegistry, Runnable::run, config);
  }
}
