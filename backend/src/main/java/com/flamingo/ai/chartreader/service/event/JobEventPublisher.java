package com.flamingo.ai.chartreader.service.event;

import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Multicasts job, settings and CSV notifications to connected observers.
 *
 * <p>Delivery is best effort: events emitted while nobody listens, or to a subscriber that cannot
 * keep up, are dropped.
 */
@Component
@Slf4j
public class JobEventPublisher {

  private final Sinks.Many<JobEvent> sink = Sinks.many().multicast().directBestEffort();

  public Flux<JobEvent> events() {
    return sink.asFlux();
  }

  public void jobChanged(Job job) {
    publish(new JobEvent(JobEvent.TYPE_JOB, job));
  }

  public void settingsChanged(WorkerSettings settings) {
    publish(new JobEvent(JobEvent.TYPE_SETTINGS, settings));
  }

  public void csvUpdated(String updatedAt, long totalRows) {
    publish(
        new JobEvent(
            JobEvent.TYPE_CSV_UPDATED, Map.of("updatedAt", updatedAt, "total", totalRows)));
  }

  public void csvFailed(String message) {
    publish(
        new JobEvent(JobEvent.TYPE_CSV_ERROR, Map.of("message", message == null ? "" : message)));
  }

  private synchronized void publish(JobEvent event) {
    Sinks.EmitResult result = sink.tryEmitNext(event);
    if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
      log.debug("Dropped {} event: {}", event.type(), result);
    }
  }
}
