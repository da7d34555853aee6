package com.flamingo.ai.chartreader.service.worker;

import com.flamingo.ai.chartreader.config.ChartReaderConfig;
import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import com.flamingo.ai.chartreader.exception.JobCancelledException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Polls the queue and runs claimed jobs on the job executor.
 *
 * <p>Each tick re-reads the worker settings and claims up to {@code concurrency - active} jobs. A
 * tick requested while another is running results in exactly one more pass. The poll loop is
 * started by the startup runner once interrupted jobs have been swept back to the queue.
 */
@Component
@Slf4j
public class ExtractionWorker implements SmartLifecycle {

  private final JobClaimService claimService;
  private final JobPipeline pipeline;
  private final JobStateService jobState;
  private final WorkerSettingsService settingsService;
  private final JobRepository jobRepository;
  private final Executor jobExecutor;
  private final TaskScheduler scheduler;
  private final ChartReaderConfig config;
  private final MeterRegistry meterRegistry;

  private final Map<UUID, CancellationToken> tokens = new ConcurrentHashMap<>();
  private final AtomicBoolean ticking = new AtomicBoolean();
  private final AtomicBoolean tickRequested = new AtomicBoolean();
  private volatile boolean running;
  private ScheduledFuture<?> pollTask;

  public ExtractionWorker(
      JobClaimService claimService,
      JobPipeline pipeline,
      JobStateService jobState,
      WorkerSettingsService settingsService,
      JobRepository jobRepository,
      @Qualifier("jobExecutor") Executor jobExecutor,
      @Qualifier("workerPollScheduler") TaskScheduler scheduler,
      ChartReaderConfig config,
      MeterRegistry meterRegistry) {
    this.claimService = claimService;
    this.pipeline = pipeline;
    this.jobState = jobState;
    this.settingsService = settingsService;
    this.jobRepository = jobRepository;
    this.jobExecutor = jobExecutor;
    this.scheduler = scheduler;
    this.config = config;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    long interval = Math.max(100, config.getWorker().getPollIntervalMs());
    pollTask = scheduler.scheduleWithFixedDelay(this::tick, Duration.ofMillis(interval));
    running = true;
    log.info("Extraction worker started, polling every {} ms", interval);
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    log.info("Extraction worker stopped, {} job(s) still running", tokens.size());
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return false;
  }

  /** Runs one poll pass, or marks another pass due when one is already running. */
  public void tick() {
    tickRequested.set(true);
    while (tickRequested.get() && ticking.compareAndSet(false, true)) {
      try {
        tickRequested.set(false);
        pollOnce();
      } catch (Exception e) {
        log.error("Worker tick failed: {}", e.getMessage(), e);
      } finally {
        ticking.set(false);
      }
    }
  }

  /** Schedules a tick right away when the poll loop runs. */
  public void requestTick() {
    if (!running) {
      return;
    }
    try {
      scheduler.schedule(this::tick, Instant.now());
    } catch (RejectedExecutionException e) {
      log.warn("Tick request rejected: {}", e.getMessage());
    }
  }

  /**
   * Stops a queued, running or parked job. A running pipeline unwinds at its next checkpoint.
   *
   * @return whether the job's status changed
   */
  public boolean requestCancel(UUID jobId) {
    boolean cancelled = jobState.cancelActive(jobId, JobCancelledException.DEFAULT_REASON);
    CancellationToken token = tokens.get(jobId);
    if (token != null) {
      token.cancel(JobCancelledException.DEFAULT_REASON);
    }
    if (cancelled) {
      log.info("Cancellation requested for job {}", jobId);
    }
    return cancelled;
  }

  /** Number of jobs this process is running right now. */
  public int activeJobCount() {
    return tokens.size();
  }

  private void pollOnce() {
    WorkerSettings settings = settingsService.current();
    if (settings.isPaused()) {
      return;
    }
    long persisted = jobRepository.countByStatus(JobStatus.PROCESSING);
    long active = Math.max(persisted, tokens.size());
    int available = (int) Math.max(0, settings.getConcurrency() - active);
    if (available == 0) {
      return;
    }

    List<Job> claimed = claimService.claim(available);
    for (Job job : claimed) {
      launch(job);
    }
  }

  private void launch(Job job) {
    UUID jobId = job.getId();
    CancellationToken token = new CancellationToken();
    tokens.put(jobId, token);
    meterRegistry.counter("job.claimed").increment();
    jobState.publish(jobId);
    try {
      jobExecutor.execute(() -> runJob(jobId, token));
    } catch (RejectedExecutionException e) {
      log.warn("Job executor rejected job {}, returning it to the queue", jobId);
      tokens.remove(jobId, token);
      jobState.releaseClaim(jobId);
    }
  }

  private void runJob(UUID jobId, CancellationToken token) {
    try {
      JobPipeline.Outcome outcome = pipeline.process(jobId, token);
      log.debug("Job {} finished: {}", jobId, outcome);
    } finally {
      tokens.remove(jobId, token);
      requestTick();
    }
  }
}
