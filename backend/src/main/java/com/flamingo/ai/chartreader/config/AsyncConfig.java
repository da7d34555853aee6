package com.flamingo.ai.chartreader.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Executors for the extraction worker. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs claimed jobs; the worker never submits more than the stored concurrency limit. */
  @Bean(name = "jobExecutor")
  public Executor jobExecutor(ChartReaderConfig config) {
    int size = Math.max(1, config.getWorker().getMaxConcurrency());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("chart-job-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  /** Hosts remote model calls so a stop request can abandon them without waiting. */
  @Bean(name = "llmCallExecutor")
  public Executor llmCallExecutor(ChartReaderConfig config) {
    int size = Math.max(1, config.getWorker().getMaxConcurrency());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size * 2);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("llm-call-");
    executor.initialize();
    return executor;
  }

  /** Single thread: CSV export passes never overlap. */
  @Bean(name = "csvExportExecutor")
  public Executor csvExportExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("csv-export-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "workerPollScheduler")
  public TaskScheduler workerPollScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("worker-poll-");
    scheduler.initialize();
    return scheduler;
  }
}
