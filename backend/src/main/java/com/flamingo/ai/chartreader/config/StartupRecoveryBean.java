package com.flamingo.ai.chartreader.config;

import com.flamingo.ai.chartreader.service.storage.FileStorageService;
import com.flamingo.ai.chartreader.service.worker.ExtractionWorker;
import com.flamingo.ai.chartreader.service.worker.JobStateService;
import com.flamingo.ai.chartreader.service.worker.WorkerSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Prepares the worker on application startup.
 *
 * <p>This bean runs once and:
 *
 * <ul>
 *   <li>Creates the storage directories
 *   <li>Stores the default worker settings when none exist
 *   <li>Returns jobs interrupted by the previous shutdown to the queue
 *   <li>Starts the poll loop when {@code chart-reader.worker.auto-start} is set
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StartupRecoveryBean implements CommandLineRunner {

  private final FileStorageService storage;
  private final WorkerSettingsService settingsService;
  private final JobStateService jobState;
  private final ExtractionWorker worker;
  private final ChartReaderConfig config;

  @Override
  public void run(String... args) {
    storage.ensureDirectories();
    settingsService.seedIfAbsent();

    int requeued = jobState.requeueInterrupted();
    if (requeued > 0) {
      log.info("Returned {} interrupted job(s) to the queue", requeued);
    }

    if (config.getWorker().isAutoStart()) {
      worker.start();
      worker.requestTick();
    } else {
      log.info("Worker auto-start disabled");
    }
  }
}
