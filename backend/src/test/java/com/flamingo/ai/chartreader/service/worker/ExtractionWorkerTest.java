package com.flamingo.ai.chartreader.service.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ExtractionWorker Tests")
class ExtractionWorkerTest {

  @Mock private JobClaimService claimService;
  @Mock private JobPipeline pipeline;
  @Mock private JobStateService jobState;
  @Mock private WorkerSettingsService settingsService;
  @Mock private JobRepository jobRepository;
  @Mock private Executor jobExecutor;
  @Mock private TaskScheduler scheduler;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private final List<Runnable> submitted = new ArrayList<>();
  private ExtractionWorker worker;

  @BeforeEach
  void setUp() {
    worker =
        new ExtractionWorker(
            claimService,
            pipeline,
            jobState,
            settingsService,
            jobRepository,
            jobExecutor,
            scheduler,
            new ChartReaderConfig(),
            meterRegistry);

    when(meterRegistry.counter(anyString())).thenReturn(counter);
    givenSettings(2, false);
    doAnswer(
            invocation -> {
              submitted.add(invocation.getArgument(0));
              return null;
            })
        .when(jobExecutor)
        .execute(any(Runnable.class));
  }

  @Test
  @DisplayName("Tick with an empty queue should change nothing")
  void shouldDoNothing_whenQueueEmpty() {
    when(claimService.claim(2)).thenReturn(List.of());

    worker.tick();

    verify(claimService).claim(2);
    verifyNoInteractions(jobState, pipeline, jobExecutor);
  }

  @Test
  void shouldNotClaim_whenPaused() {
    givenSettings(2, true);

    worker.tick();

    verifyNoInteractions(claimService, jobRepository);
  }

  @Test
  @DisplayName("Should claim only the free slots")
  void shouldClaimRemainingCapacity() {
    givenSettings(3, false);
    when(jobRepository.countByStatus(JobStatus.PROCESSING)).thenReturn(2L);
    when(claimService.claim(1)).thenReturn(List.of());

    worker.tick();

    verify(claimService).claim(1);
  }

  @Test
  void shouldNotClaim_whenAtConcurrencyLimit() {
    when(jobRepository.countByStatus(JobStatus.PROCESSING)).thenReturn(2L);

    worker.tick();

    verify(claimService, never()).claim(anyInt());
  }

  @Test
  @DisplayName("Should hand each claimed job to the pipeline")
  void shouldRunClaimedJobs() {
    Job first = job();
    Job second = job();
    when(claimService.claim(2)).thenReturn(List.of(first, second));

    worker.tick();

    assertThat(submitted).hasSize(2);
    assertThat(worker.activeJobCount()).isEqualTo(2);
    verify(jobState).publish(first.getId());

    submitted.forEach(Runnable::run);

    verify(pipeline).process(eq(first.getId()), any(CancellationToken.class));
    verify(pipeline).process(eq(second.getId()), any(CancellationToken.class));
    assertThat(worker.activeJobCount()).isZero();
  }

  @Test
  void shouldReleaseClaim_whenExecutorRejects() {
    Job job = job();
    when(claimService.claim(2)).thenReturn(List.of(job));
    doThrow(new RejectedExecutionException("full")).when(jobExecutor).execute(any(Runnable.class));

    worker.tick();

    verify(jobState).releaseClaim(job.getId());
    assertThat(worker.activeJobCount()).isZero();
  }

  @Test
  @DisplayName("Cancelling a running job should fire its token")
  void shouldFireToken_whenRunningJobCancelled() {
    Job job = job();
    when(claimService.claim(2)).thenReturn(List.of(job));
    when(jobState.cancelActive(job.getId(), "Cancelled by user")).thenReturn(true);
    AtomicReference<CancellationToken> seen = new AtomicReference<>();
    when(pipeline.process(eq(job.getId()), any(CancellationToken.class)))
        .thenAnswer(
            invocation -> {
              seen.set(invocation.getArgument(1));
              return JobPipeline.Outcome.CANCELLED;
            });
    worker.tick();

    boolean cancelled = worker.requestCancel(job.getId());
    submitted.get(0).run();

    assertThat(cancelled).isTrue();
    assertThat(seen.get().isCancelled()).isTrue();
    assertThat(seen.get().getReason()).isEqualTo("Cancelled by user");
  }

  @Test
  void shouldReportFalse_whenCancellingInactiveJob() {
    UUID jobId = UUID.randomUUID();
    when(jobState.cancelActive(jobId, "Cancelled by user")).thenReturn(false);

    assertThat(worker.requestCancel(jobId)).isFalse();
  }

  @Test
  void shouldSchedulePolling_whenStarted() {
    worker.start();
    worker.start();

    assertThat(worker.isRunning()).isTrue();
    assertThat(worker.isAutoStartup()).isFalse();
    verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMillis(1000)));

    worker.stop();
    assertThat(worker.isRunning()).isFalse();
  }

  @Test
  void shouldIgnoreTickRequests_whenStopped() {
    worker.requestTick();

    verifyNoInteractions(scheduler);
  }

  private void givenSettings(int concurrency, boolean paused) {
    when(settingsService.current())
        .thenReturn(
            WorkerSettings.builder().concurrency(concurrency).paused(paused).model("m").build());
  }

  private static Job job() {
    return Job.builder().id(UUID.randomUUID()).filename("2024-01-05_chart.png").build();
  }
}
