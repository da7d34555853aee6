package com.flamingo.ai.chartreader.api.sse;

import com.flamingo.ai.chartreader.api.dto.response.JobResponse;
import com.flamingo.ai.chartreader.api.dto.response.SettingsResponse;
import com.flamingo.ai.chartreader.api.dto.response.StateResponse;
import com.flamingo.ai.chartreader.domain.entity.Job;
import com.flamingo.ai.chartreader.domain.entity.WorkerSettings;
import com.flamingo.ai.chartreader.service.event.JobEvent;
import com.flamingo.ai.chartreader.service.event.JobEventPublisher;
import com.flamingo.ai.chartreader.service.job.JobService;
import com.flamingo.ai.chartreader.service.worker.ExtractionWorker;
import com.flamingo.ai.chartreader.service.worker.WorkerSettingsService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Streams job, settings and CSV notifications as Server-Sent Events. */
@RestController
@RequestMapping("/api")
@Slf4j
public class EventsController {

  private final JobEventPublisher publisher;
  private final JobService jobService;
  private final WorkerSettingsService settingsService;
  private final ExtractionWorker worker;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  public EventsController(
      JobEventPublisher publisher,
      JobService jobService,
      WorkerSettingsService settingsService,
      ExtractionWorker worker,
      MeterRegistry meterRegistry) {
    this.publisher = publisher;
    this.jobService = jobService;
    this.settingsService = settingsService;
    this.worker = worker;
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("sse.connections.active", activeConnections);
  }

  /**
   * Sends a {@code state} snapshot, then every change as it happens.
   *
   * @return a Flux of SSE events named after the event type
   */
  @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<Object>> events() {
    activeConnections.incrementAndGet();
    log.debug("Event stream opened, {} active", activeConnections.get());

    Mono<ServerSentEvent<Object>> snapshot =
        Mono.fromCallable(
            () ->
                toSse(
                    JobEvent.TYPE_STATE,
                    StateResponse.of(
                        settingsService.current(), jobService.list(), worker.activeJobCount())));

    return snapshot
        .concatWith(publisher.events().map(event -> toSse(event.type(), toBody(event))))
        .doOnError(
            e -> {
              log.error("Event stream error: {}", e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doFinally(
            signal -> {
              activeConnections.decrementAndGet();
              log.debug("Event stream closed ({})", signal);
            });
  }

  private static Object toBody(JobEvent event) {
    if (event.payload() instanceof Job job) {
      return JobResponse.fromEntity(job);
    }
    if (event.payload() instanceof WorkerSettings settings) {
      return SettingsResponse.fromEntity(settings);
    }
    return event.payload();
  }

  private static ServerSentEvent<Object> toSse(String type, Object body) {
    return ServerSentEvent.builder(body).event(type).build();
  }
}
