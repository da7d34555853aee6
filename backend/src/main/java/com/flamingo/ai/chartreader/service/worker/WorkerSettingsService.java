package com.flamingo.ai.chartreader.service.worker;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import com.flamingo.ai.chartreader.domain.repository.WorkerSettingsRepository;
import com.flamingo.ai.chartreader.exception.JobValidationException;
import com.flamingo.ai.chartreader.service.event.JobEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Reads and updates the operator-tunable worker settings. */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkerSettingsService {

  private final WorkerSettingsRepository repository;
  private final ChartReaderConfig config;
  private final JobEventPublisher events;

  /** Stored settings, or the configured defaults when none were stored yet. */
  @Transactional(readOnly = true)
  public WorkerSettings current() {
    return repository.findById(WorkerSettings.SINGLETON_ID).orElseGet(this::defaults);
  }

  /** Stores the configured defaults unless settings exist already. */
  @Transactional
  public WorkerSettings seedIfAbsent() {
    return repository
        .findById(WorkerSettings.SINGLETON_ID)
        .orElseGet(
            () -> {
              WorkerSettings seeded = repository.save(defaults());
              log.info(
                  "Seeded worker settings: concurrency={}, model={}",
                  seeded.getConcurrency(),
                  seeded.getModel());
              return seeded;
            });
  }

  /**
   * Applies the non-null fields.
   *
   * @throws JobValidationException when the concurrency is outside 1..max or the model is blank
   */
  @Transactional
  public WorkerSettings update(Integer concurrency, Boolean paused, String model) {
    WorkerSettings settings =
        repository.findById(WorkerSettings.SINGLETON_ID).orElseGet(this::defaults);

    int max = config.getWorker().getMaxConcurrency();
    if (concurrency != null) {
      if (concurrency < 1 || concurrency > max) {
        throw new JobValidationException("concurrency must be between 1 and " + max);
      }
      settings.setConcurrency(concurrency);
    }
    if (paused != null) {
      settings.setPaused(paused);
    }
    if (model != null) {
      if (model.isBlank()) {
        throw new JobValidationException("model must not be blank");
      }
      settings.setModel(model.trim());
    }

    WorkerSettings saved = repository.save(settings);
    log.info(
        "Worker settings updated: concurrency={}, paused={}, model={}",
        saved.getConcurrency(),
        saved.isPaused(),
        saved.getModel());
    events.settingsChanged(saved);
    return saved;
  }

  private WorkerSettings defaults() {
    ChartReaderConfig.Worker worker = config.getWorker();
    int concurrency =
        Math.max(1, Math.min(worker.getDefaultConcurrency(), worker.getMaxConcurrency()));
    return WorkerSettings.builder()
        .concurrency(concurrency)
        .paused(false)
        .model(worker.getDefaultModel())
        .build();
  }
}
