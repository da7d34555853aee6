package com.flamingo.ai.chartreader.service.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import com.flamingo.ai.chartreader.domain.repository.WorkerSettingsRepository;
import com.flamingo.ai.chartreader.exception.JobValidationException;
import com.flamingo.ai.chartreader.service.event.JobEventPublisher;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WorkerSettingsServiceTest {

  @Mock private WorkerSettingsRepository repository;
  @Mock private JobEventPublisher events;

  private ChartReaderConfig config;
  private WorkerSettingsService service;

  @BeforeEach
  void setUp() {
    config = new ChartReaderConfig();
    config.getWorker().setDefaultConcurrency(3);
    config.getWorker().setDefaultModel("gpt-default");
    service = new WorkerSettingsService(repository, config, events);
    when(repository.save(any(WorkerSettings.class))).thenAnswer(inv -> inv.getArgument(0));
  }

  @Test
  void shouldReturnDefaults_whenNothingStored() {
    when(repository.findById(WorkerSettings.SINGLETON_ID)).thenReturn(Optional.empty());

    WorkerSettings settings = service.current();

    assertThat(settings.getConcurrency()).isEqualTo(3);
    assertThat(settings.isPaused()).isFalse();
    assertThat(settings.getModel()).isEqualTo("gpt-default");
  }

  @Test
  void shouldClampDefaultConcurrency_toMaximum() {
    config.getWorker().setDefaultConcurrency(50);
    when(repository.findById(WorkerSettings.SINGLETON_ID)).thenReturn(Optional.empty());

    assertThat(service.current().getConcurrency()).isEqualTo(10);
  }

  @Test
  void shouldKeepStoredSettings_whenSeeding() {
    WorkerSettings stored = settings(5, true, "stored-model");
    when(repository.findById(WorkerSettings.SINGLETON_ID)).thenReturn(Optional.of(stored));

    assertThat(service.seedIfAbsent()).isSameAs(stored);
    verify(repository, never()).save(any());
  }

  @Test
  void shouldApplyOnlyGivenFields_andPublish() {
    WorkerSettings stored = settings(2, false, "old-model");
    when(repository.findById(WorkerSettings.SINGLETON_ID)).thenReturn(Optional.of(stored));

    WorkerSettings updated = service.update(null, true, "  new-model ");

    assertThat(updated.getConcurrency()).isEqualTo(2);
    assertThat(updated.isPaused()).isTrue();
    assertThat(updated.getModel()).isEqualTo("new-model");
    verify(events).settingsChanged(updated);
  }

  @Test
  void shouldRejectConcurrency_outsideRange() {
    when(repository.findById(WorkerSettings.SINGLETON_ID))
        .thenReturn(Optional.of(settings(2, false, "m")));

    assertThatThrownBy(() -> service.update(0, null, null))
        .isInstanceOf(JobValidationException.class)
        .hasMessage("concurrency must be between 1 and 10");
    assertThatThrownBy(() -> service.update(11, null, null))
        .isInstanceOf(JobValidationException.class);
    verify(events, never()).settingsChanged(any());
  }

  @Test
  void shouldRejectBlankModel() {
    when(repository.findById(WorkerSettings.SINGLETON_ID))
        .thenReturn(Optional.of(settings(2, false, "m")));

    assertThatThrownBy(() -> service.update(null, null, "   "))
        .isInstanceOf(JobValidationException.class)
        .hasMessage("model must not be blank");
  }

  private static WorkerSettings settings(int concurrency, boolean paused, String model) {
    return WorkerSettings.builder().concurrency(concurrency).paused(paused).model(model).build();
  }
}
