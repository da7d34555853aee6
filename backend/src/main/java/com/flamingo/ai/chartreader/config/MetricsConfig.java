package com.flamingo.ai.chartreader.config;

import com.flamingo.ai.chartreader.domain.enums.JobStatus;
import com.flamingo.ai.chartreader.domain.repository.JobRepository;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.Locale;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation for method-level timing metrics.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Queue depth gauges, read from the job store on scrape. */
  @Bean
  public MeterBinder jobQueueGauges(JobRepository jobRepository) {
    return registry -> {
      for (JobStatus status :
          new JobStatus[] {JobStatus.QUEUED, JobStatus.PROCESSING, JobStatus.AWAITING_REVIEW}) {
        Gauge.builder("jobs.by.status", jobRepository, repo -> repo.countByStatus(status))
            .tag("status", status.name().toLowerCase(Locale.ROOT))
            .register(registry);
      }
    };
  }
}
